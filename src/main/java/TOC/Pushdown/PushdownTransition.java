package TOC.Pushdown;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import TOC.Model.Symbol;

/**
 * {@code (from, input, pop) -> (to, push)}.
 * @param input input symbol to consume, or {@link Symbol#EPSILON}
 * @param pop required stack top, popped when taken, or {@link Symbol#EPSILON} to leave the stack alone
 * @param push symbols to push; the first one ends up on top. Empty means push nothing.
 */
public record PushdownTransition(String from, Symbol input, Symbol pop, String to, List<Symbol> push) {

    public PushdownTransition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(pop, "pop");
        Objects.requireNonNull(to, "to");
        push = List.copyOf(push);
    }

    @Override
    public String toString() {
        String pushed = push.isEmpty() ? "eps" : push.stream().map(Symbol::text).collect(Collectors.joining());
        return from + " (" + (input.isEpsilon() ? "eps" : input.text()) + ", " + (pop.isEpsilon() ? "eps" : pop.text())
                + ") -> (" + to + ", " + pushed + ")";
    }
}
