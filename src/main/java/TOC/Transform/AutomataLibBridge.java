package TOC.Transform;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

/**
 * Conversions from {@link FiniteAutomaton} to AutomataLib's compact automata, used to cross-check derived automata
 * against AutomataLib's own determinization and minimization.
 */
public class AutomataLibBridge {

    private AutomataLibBridge() {}

    public static Alphabet<Symbol> alphabet(FiniteAutomaton fa) {
        return Alphabets.fromCollection(fa.getAlphabet());
    }

    public static CompactDFA<Symbol> toCompactDFA(FiniteAutomaton dfa) {
        return toCompactDFA(dfa, alphabet(dfa));
    }

    /**
     * @param dfa deterministic automaton; missing transitions stay undefined in the result
     * @param alphabet alphabet of the result, a superset of the automaton's
     */
    public static CompactDFA<Symbol> toCompactDFA(FiniteAutomaton dfa, Alphabet<Symbol> alphabet) {
        if (!dfa.isDeterministic()) {
            throw new ValidationException("Not a deterministic automaton");
        }
        final CompactDFA<Symbol> out = new CompactDFA<>(alphabet);
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        for (String s : dfa.getStates()) {
            boolean acc = dfa.isAccepting(s);
            int id = s.equals(dfa.getStartState()) ? out.addInitialState(acc) : out.addState(acc);
            ids.put(s, id);
        }
        for (String s : dfa.getStates()) {
            for (Map.Entry<Symbol, SortedSet<String>> edge : dfa.getTransitions(s).entrySet()) {
                out.setTransition(ids.getInt(s), alphabet.getSymbolIndex(edge.getKey()), ids.getInt(edge.getValue().first()));
            }
        }
        return out;
    }

    /**
     * @param nfa automaton without epsilon edges
     */
    public static CompactNFA<Symbol> toCompactNFA(FiniteAutomaton nfa) {
        if (nfa.hasEpsilonTransitions()) {
            throw new ValidationException("AutomataLib NFAs have no epsilon edges");
        }
        final Alphabet<Symbol> alphabet = alphabet(nfa);
        final CompactNFA<Symbol> out = new CompactNFA<>(alphabet, nfa.size());
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        for (String s : nfa.getStates()) {
            int id = out.addState(nfa.isAccepting(s));
            ids.put(s, id);
        }
        out.setInitial(ids.getInt(nfa.getStartState()), true);
        for (String s : nfa.getStates()) {
            for (Map.Entry<Symbol, SortedSet<String>> edge : nfa.getTransitions(s).entrySet()) {
                for (String t : edge.getValue()) {
                    out.addTransition(ids.getInt(s), edge.getKey(), ids.getInt(t));
                }
            }
        }
        return out;
    }

    /**
     * Size of the minimal DFA AutomataLib's Hopcroft minimizer computes for this DFA.
     */
    public static int minimalSize(FiniteAutomaton dfa) {
        final Alphabet<Symbol> alphabet = alphabet(dfa);
        return HopcroftMinimizer.minimizeDFA(toCompactDFA(dfa, alphabet), alphabet).size();
    }

    /**
     * Whether two deterministic automata accept the same language over the union of their alphabets.
     */
    public static boolean equivalent(FiniteAutomaton dfa1, FiniteAutomaton dfa2) {
        SortedSet<Symbol> symbols = new TreeSet<>(dfa1.getAlphabet());
        symbols.addAll(dfa2.getAlphabet());
        final Alphabet<Symbol> alphabet = Alphabets.fromCollection(symbols);
        return Automata.testEquivalence(toCompactDFA(dfa1, alphabet), toCompactDFA(dfa2, alphabet), alphabet);
    }
}
