package TOC.Turing;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record TuringTransition(TransitionKey key, String nextState, List<Action> actions) {

    public TuringTransition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(nextState, "nextState");
        actions = List.copyOf(actions);
    }

    @Override
    public String toString() {
        return key + " -> (" + actions.stream().map(Action::toString).collect(Collectors.joining(", ")) + ", " + nextState + ")";
    }
}
