package TOC.Turing;

import java.util.List;

/**
 * Outcome of one {@link MultiTapeTuringMachine#step()} call, with enough of the configuration to render it.
 */
public record StepResult(StepStatus status, HaltReason haltReason, String message,
                         String state, int stepCount, List<TapeWindow> tapes) {

    public StepResult {
        tapes = List.copyOf(tapes);
    }

    public boolean isRunning() {
        return status == StepStatus.RUNNING;
    }

    public boolean isAccepted() {
        return haltReason == HaltReason.ACCEPTED;
    }
}
