package authzen.spi;

/**
 * Exception thrown when an entity provider or decision engine fails to initialize.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
