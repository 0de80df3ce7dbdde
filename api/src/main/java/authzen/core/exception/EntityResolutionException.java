package authzen.core.exception;

/**
 * Entity data could not be read from the entity provider.
 *
 * <p>The evaluation that needed the data is aborted. The failure is usually transient
 * (store throttling, network), so callers may retry the whole request.
 */
public class EntityResolutionException extends RuntimeException {

    public EntityResolutionException(String message) {
        super(message);
    }

    public EntityResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
