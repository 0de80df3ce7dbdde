package authzen.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import authzen.core.exception.EntityResolutionException;
import authzen.core.exception.EvaluationFailedException;
import authzen.core.exception.UnsupportedSearchException;

/**
 * Global exception mappers for converting core exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapEvaluationFailedException(EvaluationFailedException e) {
        LOG.errorv(e, "Evaluation failed: {0}", e.getMessage());
        return toResponse(AuthzenProblem.evaluationFailed("The decision engine could not evaluate the request"));
    }

    @ServerExceptionMapper
    public Response mapEntityResolutionException(EntityResolutionException e) {
        LOG.warnv("Entity resolution failed: {0}", e.getMessage());
        return toResponse(AuthzenProblem.entityResolutionFailed("Entity data is temporarily unavailable"));
    }

    @ServerExceptionMapper
    public Response mapUnsupportedSearchException(UnsupportedSearchException e) {
        LOG.debugv("Unsupported search: {0}", e.getMessage());
        return toResponse(AuthzenProblem.notImplemented(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AuthzenProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
