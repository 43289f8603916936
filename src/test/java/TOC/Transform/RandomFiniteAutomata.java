package TOC.Transform;

import java.util.List;
import java.util.Random;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.Symbol;
import net.automatalib.common.util.random.RandomUtil;

/**
 * Random automata in the style of Tabakov and Vardi: a fixed number of edges per label, a fixed number of accept
 * states, state 0 initial and accepting.
 */
public class RandomFiniteAutomata {
    static final List<String> UNIT_LABELS = List.of("a", "b");

    /**
     * @param edgeNum edges per label, in [0, size*size]
     * @param acceptNum accept states, in [1, size]
     * @param labels edge labels; "" is epsilon, longer strings are multi-character labels
     */
    public static FiniteAutomaton generate(Random r, int size, int edgeNum, int acceptNum, List<String> labels) {
        assert acceptNum > 0 && acceptNum <= size;
        assert edgeNum >= 0 && edgeNum <= size * size;

        FiniteAutomaton.Builder builder = FiniteAutomaton.builder();
        for (int i = 0; i < size; i++) {
            builder.state(name(i));
        }
        builder.start(name(0)).accept(name(0));
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            builder.accept(name(f));
        }
        for (String label : labels) {
            if (!label.isEmpty()) {
                builder.symbol(Symbol.of(label));
            }
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
                builder.transition(name(edgeIndex / size), label, name(edgeIndex % size));
            }
        }
        return builder.build();
    }

    /**
     * Unit-labelled NFA over {a, b} without epsilon edges, with transition density 1.25 and acceptance density 0.5.
     */
    public static FiniteAutomaton unitNFA(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        return generate(random, size, Math.round(1.25f * size), Math.max(1, Math.round(0.5f * size)), UNIT_LABELS);
    }

    /**
     * NFA with epsilon edges and two-character labels on top of the unit labels.
     */
    public static FiniteAutomaton epsilonNFA(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        return generate(random, size, size, Math.max(1, size / 2), List.of("a", "b", "", "ab"));
    }

    static String name(int i) {
        return "s" + i;
    }
}
