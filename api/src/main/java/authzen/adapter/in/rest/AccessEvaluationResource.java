package authzen.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import authzen.adapter.in.dto.DecisionDto;
import authzen.adapter.in.dto.EvaluationRequestDto;
import authzen.adapter.in.dto.EvaluationsRequestDto;
import authzen.adapter.in.dto.EvaluationsResponseDto;
import authzen.core.port.in.AccessEvaluation;

/**
 * AuthZEN access evaluation API.
 *
 * <ul>
 *   <li>{@code POST /access/v1/evaluation} - single decision</li>
 *   <li>{@code POST /access/v1/evaluations} - batch with optional short-circuit semantics</li>
 * </ul>
 */
@Path("/access/v1")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccessEvaluationResource {

    private final AccessEvaluation accessEvaluation;

    @Inject
    public AccessEvaluationResource(AccessEvaluation accessEvaluation) {
        this.accessEvaluation = accessEvaluation;
    }

    @POST
    @Path("/evaluation")
    public Uni<DecisionDto> evaluation(@NotNull(message = "request body is required") @Valid EvaluationRequestDto request) {
        return accessEvaluation.evaluation(request.toModel()).map(DecisionDto::fromModel);
    }

    /**
     * Evaluate a batch.
     *
     * @param request defaults plus items
     * @return decisions in request order, truncated by the batch semantics
     */
    @POST
    @Path("/evaluations")
    public Uni<EvaluationsResponseDto> evaluations(
            @NotNull(message = "request body is required") @Valid EvaluationsRequestDto request) {
        return accessEvaluation.evaluations(request.toModel()).map(EvaluationsResponseDto::fromModel);
    }
}
