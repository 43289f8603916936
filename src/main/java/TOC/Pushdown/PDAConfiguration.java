package TOC.Pushdown;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import TOC.Model.Symbol;

/**
 * Immutable search node. The last element of {@code stack} is the top.
 */
public record PDAConfiguration(String state, int position, List<Symbol> stack) {

    public PDAConfiguration {
        stack = List.copyOf(stack);
    }

    /**
     * @return the stack top, or null for an empty stack
     */
    public Symbol top() {
        return stack.isEmpty() ? null : stack.get(stack.size() - 1);
    }

    /**
     * Configuration after taking {@code t}, assuming it applies.
     */
    public PDAConfiguration apply(PushdownTransition t) {
        List<Symbol> next = new ArrayList<>(stack.size() + t.push().size());
        next.addAll(stack);
        if (!t.pop().isEpsilon()) {
            next.remove(next.size() - 1);
        }
        for (int i = t.push().size() - 1; i >= 0; i--) {
            next.add(t.push().get(i));
        }
        return new PDAConfiguration(t.to(), t.input().isEpsilon() ? position : position + 1, next);
    }

    @Override
    public String toString() {
        return "(" + state + ", " + position + ", "
                + stack.stream().map(Symbol::text).collect(Collectors.joining()) + ")";
    }
}
