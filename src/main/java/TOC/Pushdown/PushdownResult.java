package TOC.Pushdown;

/**
 * @param verdict outcome of the search
 * @param explored number of configurations expanded
 * @param configuration the accepting configuration, or the last one expanded
 * @param diagnostic human-readable summary
 */
public record PushdownResult(Verdict verdict, int explored, PDAConfiguration configuration, String diagnostic) {

    public enum Verdict {
        ACCEPTED,
        /** Every reachable configuration was explored without acceptance. */
        REJECTED,
        /** The step bound ran out first; the word may or may not be accepted. */
        EXHAUSTED
    }

    public boolean accepted() {
        return verdict == Verdict.ACCEPTED;
    }
}
