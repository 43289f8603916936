package TOC.Transform;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.Symbol;

/**
 * Rewrites every multi-character edge as a chain of single-character edges through fresh intermediate states.
 */
public class UnitLabelExpansion {

    private UnitLabelExpansion() {}

    /**
     * @param fa automaton whose labels may span several characters
     * @return equivalent automaton where each non-epsilon label is one character long
     */
    public static FiniteAutomaton expand(FiniteAutomaton fa) {
        FiniteAutomaton.Builder out = FiniteAutomaton.builder()
                .start(fa.getStartState());
        Set<String> taken = new HashSet<>(fa.getStates());
        for (String s : fa.getStates()) {
            out.state(s);
        }
        for (String s : fa.getAcceptStates()) {
            out.accept(s);
        }
        for (Symbol a : fa.getAlphabet()) {
            for (int i = 0; i < a.length(); i++) {
                out.symbol(Symbol.of(a.text().charAt(i)));
            }
        }

        for (String from : fa.getStates()) {
            for (Map.Entry<Symbol, SortedSet<String>> edge : fa.getTransitions(from).entrySet()) {
                Symbol label = edge.getKey();
                for (String to : edge.getValue()) {
                    if (label.isEpsilon() || label.length() == 1) {
                        out.transition(from, label, to);
                    } else {
                        chain(out, taken, from, label.text(), to);
                    }
                }
            }
        }
        return out.build();
    }

    private static void chain(FiniteAutomaton.Builder out, Set<String> taken, String from, String label, String to) {
        String prev = from;
        for (int i = 0; i < label.length() - 1; i++) {
            String mid = freshName(taken, from + "." + label + "." + to + "." + (i + 1));
            out.state(mid);
            out.transition(prev, Symbol.of(label.charAt(i)), mid);
            prev = mid;
        }
        out.transition(prev, Symbol.of(label.charAt(label.length() - 1)), to);
    }

    private static String freshName(Set<String> taken, String candidate) {
        String name = candidate;
        while (!taken.add(name)) {
            name = name + "'";
        }
        return name;
    }
}
