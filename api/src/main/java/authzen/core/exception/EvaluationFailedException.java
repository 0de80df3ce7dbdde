package authzen.core.exception;

/**
 * The decision engine call failed.
 *
 * <p>Raised for the whole evaluation or batch; no partial decisions are returned.
 */
public class EvaluationFailedException extends RuntimeException {

    public EvaluationFailedException(String message) {
        super(message);
    }

    public EvaluationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
