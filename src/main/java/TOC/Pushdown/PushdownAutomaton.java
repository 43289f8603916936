package TOC.Pushdown;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;

/**
 * Immutable, validated nondeterministic pushdown automaton.
 */
public class PushdownAutomaton {
    private final Set<String> states;
    private final String startState;
    private final Set<String> acceptStates;
    private final Symbol initialStackSymbol;
    private final List<PushdownTransition> transitions;

    private PushdownAutomaton(Builder b) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(b.states));
        this.startState = b.startState;
        this.acceptStates = Collections.unmodifiableSet(new LinkedHashSet<>(b.acceptStates));
        this.initialStackSymbol = b.initialStackSymbol;
        this.transitions = List.copyOf(b.transitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getStates() {
        return states;
    }

    public String getStartState() {
        return startState;
    }

    public Set<String> getAcceptStates() {
        return acceptStates;
    }

    public boolean isAccepting(String state) {
        return acceptStates.contains(state);
    }

    public Symbol getInitialStackSymbol() {
        return initialStackSymbol;
    }

    public List<PushdownTransition> getTransitions() {
        return transitions;
    }

    public static final class Builder {
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> acceptStates = new LinkedHashSet<>();
        private final Set<PushdownTransition> transitions = new LinkedHashSet<>();
        private String startState;
        private Symbol initialStackSymbol = Symbol.of("Z");

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

        public Builder initialStackSymbol(Symbol symbol) {
            this.initialStackSymbol = symbol;
            return this;
        }

        /**
         * Character shorthand: empty {@code input} or {@code pop} is epsilon, and each character of {@code push}
         * is one stack symbol, the first on top.
         * @throws ValidationException if {@code input} or {@code pop} has more than one character
         */
        public Builder transition(String from, String input, String pop, String to, String push) {
            return transition(new PushdownTransition(from, character(input), character(pop), to, Symbol.characters(push)));
        }

        public Builder transition(PushdownTransition t) {
            if (t.input().isBlank() || t.pop().isBlank()) {
                throw new ValidationException("Blank is not a pushdown symbol: " + t);
            }
            for (Symbol s : t.push()) {
                if (!s.isData()) {
                    throw new ValidationException("Only data symbols can be pushed: " + t);
                }
            }
            transitions.add(t);
            return this;
        }

        private static Symbol character(String text) {
            if (text.length() > 1) {
                throw new ValidationException("Expected at most one character, got '" + text + "'");
            }
            return text.isEmpty() ? Symbol.EPSILON : Symbol.of(text);
        }

        /**
         * Duplicate transitions are kept once.
         * @throws ValidationException if the start state is missing, the initial stack symbol is not a data symbol,
         *         or a transition or accept state names an undeclared state
         */
        public PushdownAutomaton build() {
            if (startState == null) {
                throw new ValidationException("A start state is required");
            }
            if (initialStackSymbol == null || !initialStackSymbol.isData()) {
                throw new ValidationException("The initial stack symbol must be a data symbol, got " + initialStackSymbol);
            }
            requireDeclared(startState, "start state");
            for (String accept : acceptStates) {
                requireDeclared(accept, "accept states");
            }
            for (PushdownTransition t : transitions) {
                requireDeclared(t.from(), "transition " + t);
                requireDeclared(t.to(), "transition " + t);
            }
            return new PushdownAutomaton(this);
        }

        private void requireDeclared(String state, String where) {
            if (!states.contains(state)) {
                throw new ValidationException("Undeclared state '" + state + "' in " + where);
            }
        }
    }
}
