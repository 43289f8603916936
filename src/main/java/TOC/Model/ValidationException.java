package TOC.Model;

/**
 * A model (transition relation, state set, input tapes) is malformed. Raised before anything executes.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
