package TOC.Turing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;

/**
 * Validated multi-tape Turing machine: states, start state, accept states and a deterministic transition relation.
 */
public class TuringMachineDefinition {
    private final Set<String> states;
    private final String startState;
    private final Set<String> acceptStates;
    private final int tapeCount;
    private final Map<TransitionKey, TuringTransition> transitions;

    private TuringMachineDefinition(Builder builder) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(builder.states));
        this.startState = builder.startState;
        this.acceptStates = Collections.unmodifiableSet(new LinkedHashSet<>(builder.acceptStates));
        this.tapeCount = builder.tapeCount;
        this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.transitions));
    }

    public static Builder builder(int tapeCount) {
        return new Builder(tapeCount);
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

    public int getTapeCount() {
        return tapeCount;
    }

    /**
     * @return the transition for this key, or null if the machine has none
     */
    public TuringTransition getTransition(TransitionKey key) {
        return transitions.get(key);
    }

    public List<TuringTransition> getTransitions() {
        return new ArrayList<>(transitions.values());
    }

    public static final class Builder {
        private final int tapeCount;
        private final Set<String> states = new LinkedHashSet<>();
        private final Set<String> acceptStates = new LinkedHashSet<>();
        private final Map<TransitionKey, TuringTransition> transitions = new LinkedHashMap<>();
        private String startState;

        private Builder(int tapeCount) {
            if (tapeCount < 1) {
                throw new ValidationException("A Turing machine needs at least one tape, got " + tapeCount);
            }
            this.tapeCount = tapeCount;
        }

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

        public Builder transition(String from, List<Symbol> read, List<Action> actions, String to) {
            return transition(new TuringTransition(new TransitionKey(from, read), to, actions));
        }

        public Builder transition(TuringTransition transition) {
            TransitionKey key = transition.key();
            if (key.width() != tapeCount) {
                throw new ValidationException("Invalid transition " + transition + ": expected " + tapeCount
                        + " read symbols, got " + key.width());
            }
            if (transition.actions().size() != tapeCount) {
                throw new ValidationException("Invalid transition " + transition + ": expected " + tapeCount
                        + " actions, got " + transition.actions().size());
            }
            for (Symbol s : key.read()) {
                if (s.isEpsilon()) {
                    throw new ValidationException("Invalid transition " + transition + ": epsilon cannot be read from a tape");
                }
            }
            if (transitions.containsKey(key)) {
                throw new ValidationException("Non-deterministic: duplicate transition for " + key);
            }
            transitions.put(key, transition);
            return this;
        }

        /**
         * @throws ValidationException if the start state is missing, or a transition or accept state names an
         *         undeclared state
         */
        public TuringMachineDefinition build() {
            if (startState == null) {
                throw new ValidationException("Exactly one start state is required");
            }
            requireDeclared(startState, "start state");
            for (String accept : acceptStates) {
                requireDeclared(accept, "accept state");
            }
            for (TuringTransition t : transitions.values()) {
                requireDeclared(t.key().state(), "transition " + t);
                requireDeclared(t.nextState(), "transition " + t);
            }
            return new TuringMachineDefinition(this);
        }

        private void requireDeclared(String state, String where) {
            if (!states.contains(state)) {
                throw new ValidationException("Undeclared state '" + state + "' in " + where);
            }
        }
    }
}
