package TOC.Pushdown;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import TOC.Model.SearchBudget;
import TOC.Model.Symbol;
import TOC.Pushdown.PushdownResult.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breadth-first search over (state, position, stack) configurations.
 * <p>
 * A visited set over whole configurations cuts epsilon cycles that leave the stack unchanged; the step bound
 * cuts searches whose stack grows without limit.
 */
public class PushdownEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(PushdownEvaluator.class);

    private final SearchBudget budget;

    public PushdownEvaluator() {
        this(new SearchBudget());
    }

    public PushdownEvaluator(int maxSteps) {
        this(new SearchBudget(maxSteps));
    }

    /**
     * @param budget template bound; each evaluation works on its own copy
     */
    public PushdownEvaluator(SearchBudget budget) {
        this.budget = budget;
    }

    public PushdownResult evaluate(PushdownAutomaton pda, String word) {
        return evaluate(pda, Symbol.characters(word));
    }

    public PushdownResult evaluate(PushdownAutomaton pda, List<Symbol> word) {
        final SearchBudget steps = budget.copy();
        Deque<PDAConfiguration> queue = new ArrayDeque<>();
        Set<PDAConfiguration> visited = new HashSet<>();

        PDAConfiguration init = new PDAConfiguration(pda.getStartState(), 0, List.of(pda.getInitialStackSymbol()));
        queue.add(init);
        visited.add(init);
        PDAConfiguration last = init;

        while (!queue.isEmpty()) {
            if (!steps.tryStep()) {
                LOG.debug("Step bound {} reached on {} with {} configurations queued",
                        steps.getMaxSteps(), word, queue.size());
                return new PushdownResult(Verdict.EXHAUSTED, steps.getSteps(), last,
                        "Search stopped after " + steps.getMaxSteps() + " steps without accepting; last configuration " + last);
            }
            PDAConfiguration curr = queue.poll();
            last = curr;

            if (curr.position() == word.size() && pda.isAccepting(curr.state())) {
                LOG.debug("Accepted {} in {} after {} steps", word, curr, steps.getSteps());
                return new PushdownResult(Verdict.ACCEPTED, steps.getSteps(), curr, "Accepted in configuration " + curr);
            }

            for (PushdownTransition t : pda.getTransitions()) {
                if (applies(t, curr, word)) {
                    PDAConfiguration succ = curr.apply(t);
                    if (visited.add(succ)) {
                        queue.add(succ);
                    }
                }
            }
        }

        return new PushdownResult(Verdict.REJECTED, steps.getSteps(), last,
                "Rejected after exploring all " + visited.size() + " reachable configurations; last configuration " + last);
    }

    public boolean accepts(PushdownAutomaton pda, String word) {
        return evaluate(pda, word).accepted();
    }

    static boolean applies(PushdownTransition t, PDAConfiguration c, List<Symbol> word) {
        if (!t.from().equals(c.state())) {
            return false;
        }
        if (!t.input().isEpsilon()
                && (c.position() >= word.size() || !word.get(c.position()).equals(t.input()))) {
            return false;
        }
        return t.pop().isEpsilon() || t.pop().equals(c.top());
    }
}
