package TOC.Turing;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import TOC.Model.Symbol;

/**
 * Lookup key of the transition relation: current state plus the symbol under each head, in tape order.
 */
public record TransitionKey(String state, List<Symbol> read) {

    public TransitionKey {
        Objects.requireNonNull(state, "state");
        read = List.copyOf(read);
    }

    public int width() {
        return read.size();
    }

    @Override
    public String toString() {
        return state + " (" + read.stream().map(s -> s.isBlank() ? "#" : s.text()).collect(Collectors.joining(", ")) + ")";
    }
}
