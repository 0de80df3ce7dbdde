package authzen.spi;

import java.util.Optional;

/**
 * Configuration access for entity providers and decision engines.
 *
 * <p>Providers use this to read their settings without coupling to a specific
 * configuration framework.
 */
public interface ProviderConfig {

    /**
     * Get a required configuration value.
     *
     * @param key The configuration key
     * @return The configuration value
     * @throws ProviderException if not configured
     */
    String getRequired(String key);

    /**
     * Get an optional configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the value if present
     */
    Optional<String> get(String key);

    /**
     * Get configuration value with default.
     *
     * @param key The configuration key
     * @param defaultValue The default value if not configured
     * @return The configuration value or default
     */
    String getOrDefault(String key, String defaultValue);

    /**
     * Get integer configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the integer value if present and valid
     */
    Optional<Integer> getInt(String key);
}
