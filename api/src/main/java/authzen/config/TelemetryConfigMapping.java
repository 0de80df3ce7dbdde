package authzen.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Metrics are disabled by default.
 *
 * <p>Example configuration:
 * <pre>{@code
 * authzen.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "authzen.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {

        /**
         * Enable decision metrics.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
