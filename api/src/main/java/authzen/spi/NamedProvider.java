package authzen.spi;

/**
 * Common contract of pluggable providers discovered via {@link java.util.ServiceLoader}.
 */
public interface NamedProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration, e.g. {@code authzen.entities.provider={name}}.
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority. Only available providers are considered.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider can be used with the given configuration.
     *
     * @param config Access to configuration properties
     * @return true if the provider can be used
     */
    default boolean isAvailable(ProviderConfig config) {
        return true;
    }
}
