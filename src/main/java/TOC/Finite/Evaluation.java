package TOC.Finite;

import java.util.SortedSet;

/**
 * Verdict of a finite automaton run.
 * @param accepted whether some path consumes the whole word and ends in an accept state
 * @param exploredStates every state visited by the search
 * @param diagnostic human-readable summary
 */
public record Evaluation(boolean accepted, SortedSet<String> exploredStates, String diagnostic) { }
