package authzen.core.port.out;

/**
 * Port for recording decision metrics.
 *
 * <p>Implementations handle the actual recording (e.g., Micrometer).
 */
public interface DecisionMetrics {

    boolean isEnabled();

    /**
     * Record a decision returned to a caller.
     *
     * @param operation the API operation (evaluation, evaluations, search)
     * @param allowed   whether access was granted
     */
    void recordDecision(String operation, boolean allowed);

    /**
     * Record a failed operation.
     *
     * @param operation the API operation
     * @param errorType simple name of the failure
     */
    void recordFailure(String operation, String errorType);
}
