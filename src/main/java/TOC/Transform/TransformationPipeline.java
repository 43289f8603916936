package TOC.Transform;

import TOC.Finite.FiniteAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit-label expansion, subset construction and partition-refinement minimization, in that order.
 */
public class TransformationPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(TransformationPipeline.class);

    private final boolean verify;

    public TransformationPipeline() {
        this(false);
    }

    /**
     * @param verify if true, check every run against AutomataLib: the minimal DFA must accept the same language as
     *               the subset DFA and have as many states as AutomataLib's Hopcroft minimization of it
     */
    public TransformationPipeline(boolean verify) {
        this.verify = verify;
    }

    public PipelineResult run(FiniteAutomaton fa) {
        long before = System.currentTimeMillis();
        final FiniteAutomaton unit = UnitLabelExpansion.expand(fa);
        LOG.debug("Unit-label expansion: {} -> {} states", fa.size(), unit.size());
        final FiniteAutomaton dfa = SubsetConstruction.determinize(unit);
        final FiniteAutomaton minimal = PartitionRefinement.minimize(dfa);
        long after = System.currentTimeMillis();
        LOG.debug("Pipeline: {} NFA states -> {} DFA states -> {} minimal states in {}s",
                fa.size(), dfa.size(), minimal.size(), (after - before) / 1000f);

        if (verify) {
            verify(dfa, minimal);
        }
        return new PipelineResult(unit, dfa, minimal);
    }

    public FiniteAutomaton determinize(FiniteAutomaton fa) {
        return SubsetConstruction.determinize(UnitLabelExpansion.expand(fa));
    }

    public FiniteAutomaton minimize(FiniteAutomaton fa) {
        return run(fa).minimalDfa();
    }

    private static void verify(FiniteAutomaton dfa, FiniteAutomaton minimal) {
        if (!AutomataLibBridge.equivalent(dfa, minimal)) {
            throw new IllegalStateException("Minimal DFA is not equivalent to the subset DFA");
        }
        int expected = AutomataLibBridge.minimalSize(dfa);
        if (expected != minimal.size()) {
            throw new IllegalStateException("Minimal DFA has " + minimal.size()
                    + " states, Hopcroft minimization gives " + expected);
        }
    }
}
