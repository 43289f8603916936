package TOC.Transform;

import TOC.Finite.FiniteAutomaton;
import TOC.Model.Symbol;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("IntegTest")
public class AutomataLibCrossCheckIntegTest {
    private static final TransformationPipeline PIPELINE = new TransformationPipeline();

    @Test
    void testAgainstNFAsDeterminize() {
        for (int size = 3; size < 10; size++) {
            for (int randomSeed = 0; randomSeed < 100; randomSeed++) {
                FiniteAutomaton nfa = RandomFiniteAutomata.unitNFA(randomSeed, size);
                assertMatchesAutomataLib(nfa, size + "; " + randomSeed);
            }
        }
    }

    @Test
    void testVerifyingPipelineOnEpsilonAutomata() {
        TransformationPipeline verifying = new TransformationPipeline(true);
        for (int randomSeed = 0; randomSeed < 200; randomSeed++) {
            FiniteAutomaton nfa = RandomFiniteAutomata.epsilonNFA(randomSeed, 7);
            PipelineResult result = verifying.run(nfa);
            Assertions.assertTrue(result.minimalDfa().size() <= result.dfa().size());
        }
    }

    private static void assertMatchesAutomataLib(FiniteAutomaton nfa, String debug) {
        final Alphabet<Symbol> alphabet = AutomataLibBridge.alphabet(nfa);
        final CompactNFA<Symbol> compactNFA = AutomataLibBridge.toCompactNFA(nfa);
        final CompactDFA<Symbol> expected = NFAs.determinize(compactNFA, alphabet);

        final FiniteAutomaton minimal = PIPELINE.run(nfa).minimalDfa();
        Assertions.assertEquals(expected.size(), minimal.size(), debug);
        Assertions.assertTrue(Automata.testEquivalence(expected, AutomataLibBridge.toCompactDFA(minimal, alphabet), alphabet), debug);
    }
}
