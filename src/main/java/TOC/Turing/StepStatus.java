package TOC.Turing;

public enum StepStatus {
    RUNNING,
    ACCEPT,
    HALTED
}
