package TOC.Finite;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;

/**
 * Immutable finite automaton. Labels are data symbols, possibly several characters long, or {@link Symbol#EPSILON}.
 * The same type holds NFAs, unit-labelled NFAs and DFAs; the pipeline in {@code TOC.Transform} derives one from
 * another.
 */
public class FiniteAutomaton {
    private final SortedSet<String> states;
    private final SortedSet<Symbol> alphabet;
    private final String startState;
    private final SortedSet<String> acceptStates;
    private final SortedMap<String, SortedMap<Symbol, SortedSet<String>>> transitions;

    private FiniteAutomaton(Builder b) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(b.states));
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(b.alphabet));
        this.startState = b.startState;
        this.acceptStates = Collections.unmodifiableSortedSet(new TreeSet<>(b.acceptStates));
        SortedMap<String, SortedMap<Symbol, SortedSet<String>>> copy = new TreeMap<>();
        for (Map.Entry<String, SortedMap<Symbol, SortedSet<String>>> e : b.transitions.entrySet()) {
            SortedMap<Symbol, SortedSet<String>> byLabel = new TreeMap<>();
            for (Map.Entry<Symbol, SortedSet<String>> l : e.getValue().entrySet()) {
                byLabel.put(l.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(l.getValue())));
            }
            copy.put(e.getKey(), Collections.unmodifiableSortedMap(byLabel));
        }
        this.transitions = Collections.unmodifiableSortedMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> getStates() {
        return states;
    }

    public SortedSet<Symbol> getAlphabet() {
        return alphabet;
    }

    public String getStartState() {
        return startState;
    }

    public SortedSet<String> getAcceptStates() {
        return acceptStates;
    }

    public boolean isAccepting(String state) {
        return acceptStates.contains(state);
    }

    /**
     * Outgoing edges of a state, grouped by label.
     */
    public SortedMap<Symbol, SortedSet<String>> getTransitions(String state) {
        SortedMap<Symbol, SortedSet<String>> out = transitions.get(state);
        return out == null ? Collections.emptySortedMap() : out;
    }

    public SortedSet<String> getSuccessors(String state, Symbol label) {
        SortedSet<String> succ = getTransitions(state).get(label);
        return succ == null ? Collections.emptySortedSet() : succ;
    }

    /**
     * @return the single successor, or null if there is none
     * @throws IllegalStateException if there are several
     */
    public String getSuccessor(String state, Symbol label) {
        SortedSet<String> succ = getSuccessors(state, label);
        if (succ.size() > 1) {
            throw new IllegalStateException("State " + state + " has " + succ.size() + " successors on " + label);
        }
        return succ.isEmpty() ? null : succ.first();
    }

    public int size() {
        return states.size();
    }

    public int transitionCount() {
        int count = 0;
        for (SortedMap<Symbol, SortedSet<String>> byLabel : transitions.values()) {
            for (SortedSet<String> targets : byLabel.values()) {
                count += targets.size();
            }
        }
        return count;
    }

    public boolean hasEpsilonTransitions() {
        for (SortedMap<Symbol, SortedSet<String>> byLabel : transitions.values()) {
            if (byLabel.containsKey(Symbol.EPSILON)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Every non-epsilon label consumes exactly one character.
     */
    public boolean isUnitLabelled() {
        for (SortedMap<Symbol, SortedSet<String>> byLabel : transitions.values()) {
            for (Symbol label : byLabel.keySet()) {
                if (label.isData() && label.length() != 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * No epsilon edges and at most one successor per state and label.
     */
    public boolean isDeterministic() {
        for (SortedMap<Symbol, SortedSet<String>> byLabel : transitions.values()) {
            for (Map.Entry<Symbol, SortedSet<String>> e : byLabel.entrySet()) {
                if (e.getKey().isEpsilon() || e.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Deterministic, and every state has a successor for every alphabet symbol.
     */
    public boolean isComplete() {
        if (!isDeterministic()) {
            return false;
        }
        for (String s : states) {
            if (!getTransitions(s).keySet().containsAll(alphabet)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("states=").append(states)
          .append(" start=").append(startState)
          .append(" accept=").append(acceptStates)
          .append(System.lineSeparator());
        for (Map.Entry<String, SortedMap<Symbol, SortedSet<String>>> e : transitions.entrySet()) {
            for (Map.Entry<Symbol, SortedSet<String>> l : e.getValue().entrySet()) {
                sb.append("  ").append(e.getKey()).append(" -").append(l.getKey()).append("-> ")
                  .append(l.getValue()).append(System.lineSeparator());
            }
        }
        return sb.toString();
    }

    public static final class Builder {
        private final SortedSet<String> states = new TreeSet<>();
        private final SortedSet<Symbol> alphabet = new TreeSet<>();
        private final SortedSet<String> acceptStates = new TreeSet<>();
        private final SortedMap<String, SortedMap<Symbol, SortedSet<String>>> transitions = new TreeMap<>();
        private String startState;

        private Builder() {}

        public Builder state(String... names) {
            Collections.addAll(states, names);
            return this;
        }

        public Builder start(String state) {
            this.startState = state;
            return this;
        }

        public Builder accept(String... names) {
            Collections.addAll(acceptStates, names);
            return this;
        }

        /**
         * Declare alphabet symbols that may not appear on any edge.
         */
        public Builder symbol(Symbol symbol) {
            if (!symbol.isData()) {
                throw new ValidationException("Only data symbols belong to an alphabet, got " + symbol);
            }
            alphabet.add(symbol);
            return this;
        }

        public Builder transition(String from, String label, String to) {
            return transition(from, label.isEmpty() ? Symbol.EPSILON : Symbol.of(label), to);
        }

        public Builder epsilon(String from, String to) {
            return transition(from, Symbol.EPSILON, to);
        }

        /**
         * Add an edge; data labels join the alphabet.
         */
        public Builder transition(String from, Symbol label, String to) {
            if (label.isBlank()) {
                throw new ValidationException("Blank is not a valid label on " + from + " -> " + to);
            }
            if (label.isData()) {
                alphabet.add(label);
            }
            transitions.computeIfAbsent(from, k -> new TreeMap<>())
                       .computeIfAbsent(label, k -> new TreeSet<>())
                       .add(to);
            return this;
        }

        /**
         * @throws ValidationException if the start state is missing, or an edge or accept state names an undeclared
         *         state
         */
        public FiniteAutomaton build() {
            if (startState == null) {
                throw new ValidationException("A start state is required");
            }
            requireDeclared(startState, "start state");
            for (String accept : acceptStates) {
                requireDeclared(accept, "accept states");
            }
            for (Map.Entry<String, SortedMap<Symbol, SortedSet<String>>> e : transitions.entrySet()) {
                requireDeclared(e.getKey(), "transition source");
                for (Map.Entry<Symbol, SortedSet<String>> l : e.getValue().entrySet()) {
                    for (String to : l.getValue()) {
                        requireDeclared(to, "transition " + e.getKey() + " -" + l.getKey() + "-> " + to);
                    }
                }
            }
            return new FiniteAutomaton(this);
        }

        private void requireDeclared(String state, String where) {
            if (!states.contains(state)) {
                throw new ValidationException("Undeclared state '" + state + "' in " + where);
            }
        }
    }
}
