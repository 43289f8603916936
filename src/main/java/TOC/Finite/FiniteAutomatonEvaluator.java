package TOC.Finite;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import TOC.Model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breadth-first acceptance search over (state, position) configurations. Epsilon edges keep the position; a data
 * label must occur in the word starting exactly at the position and advances by its length.
 */
public class FiniteAutomatonEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(FiniteAutomatonEvaluator.class);

    public Evaluation evaluate(FiniteAutomaton fa, String word) {
        Deque<Configuration> queue = new ArrayDeque<>();
        Set<Configuration> visited = new HashSet<>();
        SortedSet<String> explored = new TreeSet<>();

        Configuration init = new Configuration(fa.getStartState(), 0);
        queue.add(init);
        visited.add(init);

        while (!queue.isEmpty()) {
            Configuration curr = queue.poll();
            explored.add(curr.state());

            // Every enqueued configuration is tested here, including end-of-word ones reached over epsilon edges.
            if (curr.position() == word.length() && fa.isAccepting(curr.state())) {
                LOG.debug("Accepted '{}' in state {} after visiting {} configurations", word, curr.state(), visited.size());
                return new Evaluation(true, Collections.unmodifiableSortedSet(explored),
                        "Accepted in state " + curr.state() + "; explored " + explored);
            }

            for (Map.Entry<Symbol, SortedSet<String>> edge : fa.getTransitions(curr.state()).entrySet()) {
                Symbol label = edge.getKey();
                int next;
                if (label.isEpsilon()) {
                    next = curr.position();
                } else if (word.startsWith(label.text(), curr.position())) {
                    next = curr.position() + label.length();
                } else {
                    continue;
                }
                for (String to : edge.getValue()) {
                    Configuration succ = new Configuration(to, next);
                    if (visited.add(succ)) {
                        queue.add(succ);
                    }
                }
            }
        }

        LOG.debug("Rejected '{}' after visiting {} configurations", word, visited.size());
        return new Evaluation(false, Collections.unmodifiableSortedSet(explored), "Rejected; explored " + explored);
    }

    public boolean accepts(FiniteAutomaton fa, String word) {
        return evaluate(fa, word).accepted();
    }

    private record Configuration(String state, int position) { }
}
