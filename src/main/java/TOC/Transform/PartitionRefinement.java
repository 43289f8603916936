package TOC.Transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.StateSet;
import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DFA minimization by iterated partition refinement (Moore's algorithm).
 * <p>
 * Starting from the accepting / non-accepting split of the reachable states, each pass splits every block whose
 * members move, on some symbol, into different blocks of the current partition. The fixpoint is reached after at
 * most as many passes as there are reachable states.
 * <p>
 * A complete DFA yields a complete minimal DFA. A partial DFA is first completed with a fresh sink; the block of
 * states equivalent to that sink is then dropped again, so the result is the minimal partial DFA and every missing
 * transition means rejection.
 */
public class PartitionRefinement {
    private static final Logger LOG = LoggerFactory.getLogger(PartitionRefinement.class);
    private static final int DEAD_BLOCK = -1;

    private PartitionRefinement() {}

    public static FiniteAutomaton minimize(FiniteAutomaton dfa) {
        if (!dfa.isDeterministic()) {
            throw new ValidationException("Minimization needs a deterministic automaton; run SubsetConstruction first");
        }
        final List<Symbol> alphabet = new ArrayList<>(dfa.getAlphabet());
        final String sink = isPartial(dfa, alphabet) ? freshName(dfa, "dead") : null;
        final FiniteAutomaton work = sink == null ? dfa : complete(dfa, alphabet, sink);
        final SortedSet<String> reachable = reachableStates(work);

        List<SortedSet<String>> blocks = initialPartition(work, reachable);
        Object2IntMap<String> blockOf = indexBlocks(blocks);

        int passes = 0;
        boolean split = true;
        while (split) {
            if (++passes > reachable.size() + 1) {
                throw new IllegalStateException("Partition refinement did not converge after " + passes + " passes");
            }
            split = false;
            List<SortedSet<String>> next = new ArrayList<>(blocks.size());
            for (SortedSet<String> block : blocks) {
                Map<IntList, SortedSet<String>> bySignature = new LinkedHashMap<>();
                for (String s : block) {
                    bySignature.computeIfAbsent(signature(work, alphabet, blockOf, s), k -> new TreeSet<>()).add(s);
                }
                split |= bySignature.size() > 1;
                next.addAll(bySignature.values());
            }
            blocks = next;
            blockOf = indexBlocks(blocks);
        }

        final int deadBlock = sink == null ? DEAD_BLOCK : blockOf.getInt(sink);
        FiniteAutomaton minimal = extract(work, alphabet, blocks, blockOf, deadBlock, sink);
        LOG.debug("Partition refinement: {} DFA states ({} reachable) -> {} blocks in {} passes",
                dfa.size(), reachable.size(), minimal.size(), passes);
        return minimal;
    }

    /**
     * States reachable from the start state.
     */
    public static SortedSet<String> reachableStates(FiniteAutomaton fa) {
        SortedSet<String> seen = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(fa.getStartState());
        queue.add(fa.getStartState());
        while (!queue.isEmpty()) {
            String s = queue.poll();
            for (SortedSet<String> targets : fa.getTransitions(s).values()) {
                for (String t : targets) {
                    if (seen.add(t)) {
                        queue.add(t);
                    }
                }
            }
        }
        return seen;
    }

    private static List<SortedSet<String>> initialPartition(FiniteAutomaton dfa, SortedSet<String> reachable) {
        SortedSet<String> accepting = new TreeSet<>();
        SortedSet<String> rejecting = new TreeSet<>();
        for (String s : reachable) {
            (dfa.isAccepting(s) ? accepting : rejecting).add(s);
        }
        List<SortedSet<String>> blocks = new ArrayList<>(2);
        if (!accepting.isEmpty()) {
            blocks.add(accepting);
        }
        if (!rejecting.isEmpty()) {
            blocks.add(rejecting);
        }
        return blocks;
    }

    private static Object2IntMap<String> indexBlocks(List<SortedSet<String>> blocks) {
        Object2IntMap<String> blockOf = new Object2IntOpenHashMap<>();
        blockOf.defaultReturnValue(DEAD_BLOCK);
        for (int b = 0; b < blocks.size(); b++) {
            for (String s : blocks.get(b)) {
                blockOf.put(s, b);
            }
        }
        return blockOf;
    }

    private static IntList signature(FiniteAutomaton dfa, List<Symbol> alphabet, Object2IntMap<String> blockOf, String s) {
        IntList sig = new IntArrayList(alphabet.size());
        for (Symbol a : alphabet) {
            String succ = dfa.getSuccessor(s, a);
            sig.add(succ == null ? DEAD_BLOCK : blockOf.getInt(succ));
        }
        return sig;
    }

    private static boolean isPartial(FiniteAutomaton dfa, List<Symbol> alphabet) {
        for (String s : reachableStates(dfa)) {
            for (Symbol a : alphabet) {
                if (dfa.getSuccessor(s, a) == null) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String freshName(FiniteAutomaton fa, String base) {
        String name = base;
        while (fa.getStates().contains(name)) {
            name += "'";
        }
        return name;
    }

    private static FiniteAutomaton complete(FiniteAutomaton dfa, List<Symbol> alphabet, String sink) {
        FiniteAutomaton.Builder out = FiniteAutomaton.builder();
        for (Symbol a : alphabet) {
            out.symbol(a);
        }
        out.state(sink);
        out.start(dfa.getStartState());
        for (String s : dfa.getStates()) {
            out.state(s);
            if (dfa.isAccepting(s)) {
                out.accept(s);
            }
            for (Symbol a : alphabet) {
                String succ = dfa.getSuccessor(s, a);
                out.transition(s, a, succ == null ? sink : succ);
            }
        }
        for (Symbol a : alphabet) {
            out.transition(sink, a, sink);
        }
        return out.build();
    }

    /**
     * @param deadBlock block whose states only lead to rejection and is left out, or {@link #DEAD_BLOCK}
     * @param sink added sink state, or null
     */
    private static FiniteAutomaton extract(FiniteAutomaton dfa, List<Symbol> alphabet, List<SortedSet<String>> blocks,
                                           Object2IntMap<String> blockOf, int deadBlock, String sink) {
        List<String> names = new ArrayList<>(blocks.size());
        for (SortedSet<String> block : blocks) {
            SortedSet<String> members = new TreeSet<>(block);
            if (sink != null) {
                members.remove(sink);
            }
            names.add(StateSet.of(members).key());
        }

        FiniteAutomaton.Builder out = FiniteAutomaton.builder();
        for (Symbol a : alphabet) {
            out.symbol(a);
        }
        int startBlock = blockOf.getInt(dfa.getStartState());
        out.start(names.get(startBlock));

        for (int b = 0; b < blocks.size(); b++) {
            // an empty language still needs its start state
            if (b == deadBlock && b != startBlock) {
                continue;
            }
            // all members agree, so any one of them represents the block
            String rep = blocks.get(b).first();
            out.state(names.get(b));
            if (dfa.isAccepting(rep)) {
                out.accept(names.get(b));
            }
            for (Symbol a : alphabet) {
                String succ = dfa.getSuccessor(rep, a);
                if (succ != null && blockOf.getInt(succ) != deadBlock) {
                    out.transition(names.get(b), a, names.get(blockOf.getInt(succ)));
                }
            }
        }
        return out.build();
    }
}
