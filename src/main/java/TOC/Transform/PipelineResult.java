package TOC.Transform;

import TOC.Finite.FiniteAutomaton;

/**
 * Every intermediate automaton of one {@link TransformationPipeline} run.
 */
public record PipelineResult(FiniteAutomaton unitNfa, FiniteAutomaton dfa, FiniteAutomaton minimalDfa) { }
