package TOC.Turing;

public enum HaltReason {
    NONE(""),
    ACCEPTED("Accepted."),
    NO_TRANSITION("No applicable transition.");

    private final String description;

    HaltReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
