package TOC.Transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.StateSet;
import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Powerset determinization of a unit-labelled NFA with epsilon edges.
 * <p>
 * Every DFA state is named by the canonical key of its {@link StateSet}, so the same NFA always yields the same
 * DFA. The empty subset, when reachable, is kept as an explicit dead state and the DFA is complete.
 */
public class SubsetConstruction {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);
    private static final int MISSING_ELEMENT = -1;

    private SubsetConstruction() {}

    public static FiniteAutomaton determinize(FiniteAutomaton nfa) {
        if (!nfa.isUnitLabelled()) {
            throw new ValidationException("Subset construction needs single-character labels; run UnitLabelExpansion first");
        }

        // subset -> address in 'subsets'
        Object2IntMap<StateSet> registry = new Object2IntOpenHashMap<>();
        registry.defaultReturnValue(MISSING_ELEMENT);
        List<StateSet> subsets = new ArrayList<>();
        Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        FiniteAutomaton.Builder out = FiniteAutomaton.builder();
        for (Symbol a : nfa.getAlphabet()) {
            out.symbol(a);
        }

        StateSet init = EpsilonClosure.close(nfa, nfa.getStartState());
        out.start(init.key());
        stack.push(new DeterminizeRecord(init, register(registry, subsets, out, nfa, init)));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();
            for (Symbol sym : nfa.getAlphabet()) {
                StateSet succ = EpsilonClosure.close(nfa, EpsilonClosure.move(nfa, curr.subset(), sym));
                int address = registry.getInt(succ);
                if (address == MISSING_ELEMENT) {
                    address = register(registry, subsets, out, nfa, succ);
                    stack.push(new DeterminizeRecord(succ, address));
                }
                out.transition(curr.subset().key(), sym, subsets.get(address).key());
            }
        }

        FiniteAutomaton dfa = out.build();
        LOG.debug("Subset construction: {} NFA states -> {} DFA states", nfa.size(), dfa.size());
        return dfa;
    }

    private static int register(Object2IntMap<StateSet> registry, List<StateSet> subsets,
                                FiniteAutomaton.Builder out, FiniteAutomaton nfa, StateSet subset) {
        int address = subsets.size();
        registry.put(subset, address);
        subsets.add(subset);
        out.state(subset.key());
        if (subset.containsAny(nfa.getAcceptStates())) {
            out.accept(subset.key());
        }
        return address;
    }

    private record DeterminizeRecord(StateSet subset, int address) { }
}
