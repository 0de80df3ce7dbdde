package authzen.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import authzen.config.TelemetryConfigMapping;
import authzen.core.port.out.DecisionMetrics;

/**
 * Records decision metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code authzen.decisions.total} - Decisions returned, by operation and decision (allow, deny)</li>
 *   <li>{@code authzen.evaluation.failures.total} - Failed operations, by operation and error type</li>
 * </ul>
 */
@ApplicationScoped
public class DecisionMetricsRecorder implements DecisionMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public DecisionMetricsRecorder(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordDecision(String operation, boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("authzen.decisions.total")
                .description("Total number of access decisions returned")
                .tag("operation", operation)
                .tag("decision", allowed ? "allow" : "deny")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFailure(String operation, String errorType) {
        if (!enabled) {
            return;
        }

        Counter.builder("authzen.evaluation.failures.total")
                .description("Total number of failed evaluation operations")
                .tag("operation", operation)
                .tag("error", errorType)
                .register(registry)
                .increment();
    }
}
