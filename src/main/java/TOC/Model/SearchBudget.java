package TOC.Model;

/**
 * Upper bound on the configurations a search may expand before it gives up.
 */
public class SearchBudget {
    public static final int DEFAULT_MAX_STEPS = 10_000;

    private final int maxSteps;
    private int steps;

    public SearchBudget() {
        this(DEFAULT_MAX_STEPS);
    }

    public SearchBudget(int maxSteps) {
        if (maxSteps <= 0) {
            throw new ValidationException("Step bound must be positive: " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    /**
     * Count one expansion.
     * @return false once the bound has been used up
     */
    public boolean tryStep() {
        if (steps >= maxSteps) {
            return false;
        }
        steps++;
        return true;
    }

    public boolean isExhausted() {
        return steps >= maxSteps;
    }

    public int getSteps() {
        return steps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    /**
     * Fresh budget with the same bound, so one evaluator can run many searches.
     */
    public SearchBudget copy() {
        return new SearchBudget(maxSteps);
    }
}
