package authzen.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import authzen.core.model.BatchEvaluationRequest;
import authzen.core.model.Decision;
import authzen.core.model.EvaluationRequest;

/**
 * Port for answering AuthZEN access evaluation requests.
 */
public interface AccessEvaluation {

    /**
     * Evaluate a single access request.
     *
     * @param request the request
     * @return Uni with the decision
     */
    Uni<Decision> evaluation(EvaluationRequest request);

    /**
     * Evaluate a batch of requests sharing one resolved entity set.
     *
     * <p>Decisions are in item order. Under a short-circuit semantics the list ends with
     * the item that triggered it.
     *
     * @param request the batch
     * @return Uni with the decisions
     */
    Uni<List<Decision>> evaluations(BatchEvaluationRequest request);
}
