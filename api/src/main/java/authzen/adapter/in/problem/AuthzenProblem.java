package authzen.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for PDP errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses across all
 * AuthZEN endpoints.
 */
public final class AuthzenProblem {

    private AuthzenProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem evaluationFailed(String detail) {
        return HttpProblem.builder()
                .withTitle("Evaluation Failed")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem entityResolutionFailed(String detail) {
        return HttpProblem.builder()
                .withTitle("Entity Resolution Failed")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem notImplemented(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Implemented")
                .withStatus(Status.NOT_IMPLEMENTED)
                .withDetail(detail)
                .build();
    }
}
