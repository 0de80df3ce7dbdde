package authzen.core.exception;

/**
 * A search was requested but the configured entity provider cannot enumerate candidates.
 */
public class UnsupportedSearchException extends RuntimeException {

    public UnsupportedSearchException(String message) {
        super(message);
    }
}
