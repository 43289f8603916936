package TOC.Transform;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.StateSet;
import TOC.Model.Symbol;

public class EpsilonClosure {

    private EpsilonClosure() {}

    /**
     * All states reachable from {@code states} over epsilon edges only, the states themselves included.
     */
    public static StateSet close(FiniteAutomaton fa, Collection<String> states) {
        Set<String> closure = new HashSet<>(states);
        Deque<String> worklist = new ArrayDeque<>(states);
        while (!worklist.isEmpty()) {
            String s = worklist.pop();
            for (String t : fa.getSuccessors(s, Symbol.EPSILON)) {
                if (closure.add(t)) {
                    worklist.push(t);
                }
            }
        }
        return StateSet.of(closure);
    }

    public static StateSet close(FiniteAutomaton fa, String state) {
        return close(fa, Set.of(state));
    }

    /**
     * States reachable from any member of {@code states} by one {@code symbol} edge, before closure.
     */
    public static Set<String> move(FiniteAutomaton fa, StateSet states, Symbol symbol) {
        Set<String> result = new HashSet<>();
        for (String s : states) {
            result.addAll(fa.getSuccessors(s, symbol));
        }
        return result;
    }
}
