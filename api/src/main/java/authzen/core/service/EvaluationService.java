package authzen.core.service;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import authzen.core.exception.EntityResolutionException;
import authzen.core.exception.EvaluationFailedException;
import authzen.core.model.AuthorizationQuery;
import authzen.core.model.BatchEvaluationRequest;
import authzen.core.model.Decision;
import authzen.core.model.DecisionAnswer;
import authzen.core.model.EntityUid;
import authzen.core.model.EvaluationRequest;
import authzen.core.port.in.AccessEvaluation;
import authzen.core.port.out.DecisionEngine;
import authzen.core.port.out.DecisionMetrics;

/**
 * Answers AuthZEN access evaluations.
 *
 * <p>Each evaluation resolves the entities it refers to, asks the decision engine, and
 * maps the engine's answer to a protocol decision. A batch resolves its entities once
 * and calls the engine once for all items, then applies the batch's short-circuit
 * semantics to the answers in request order.
 *
 * <p>Failures are never turned into decisions: entity lookup failures surface as
 * {@link EntityResolutionException}, engine failures as {@link EvaluationFailedException}.
 * An {@link IllegalArgumentException} from the engine marks request input it cannot
 * evaluate and is passed through.
 */
@ApplicationScoped
public class EvaluationService implements AccessEvaluation {

    private static final Logger LOG = Logger.getLogger(EvaluationService.class);

    static final String OP_EVALUATION = "evaluation";
    static final String OP_EVALUATIONS = "evaluations";

    private final EntityResolver entityResolver;
    private final DecisionEngine engine;
    private final DecisionMetrics metrics;
    private final String actionType;

    @Inject
    public EvaluationService(
            EntityResolver entityResolver,
            DecisionEngine engine,
            DecisionMetrics metrics,
            @ConfigProperty(name = "authzen.engine.action-type", defaultValue = "Action") String actionType) {
        this.entityResolver = entityResolver;
        this.engine = engine;
        this.metrics = metrics;
        this.actionType = actionType;
    }

    @Override
    public Uni<Decision> evaluation(EvaluationRequest request) {
        return evaluate(request, OP_EVALUATION);
    }

    /**
     * Evaluate one request, recording metrics under the given operation name.
     *
     * @param request   the evaluation
     * @param operation operation name for metrics (evaluation, search)
     * @return Uni with the decision
     */
    public Uni<Decision> evaluate(EvaluationRequest request, String operation) {
        final var query = toQuery(request);
        return entityResolver
                .determineEntities(List.of(request.subject(), request.resource()))
                .flatMap(entities -> engine.evaluate(query, entities)
                        .onFailure(EvaluationService::notDomainFailure)
                        .transform(failure -> evaluationFailed(query, failure)))
                .map(DecisionMapper::toDecision)
                .invoke(decision -> {
                    LOG.debugf(
                            "%s %s %s on %s -> %s",
                            engine.name(), query.principal(), query.action(), query.resource(), decision.decision());
                    metrics.recordDecision(operation, decision.decision());
                })
                .onFailure()
                .invoke(failure -> metrics.recordFailure(operation, failure.getClass().getSimpleName()));
    }

    @Override
    public Uni<List<Decision>> evaluations(BatchEvaluationRequest request) {
        if (request.evaluations().isEmpty()) {
            return Uni.createFrom().item(List.of());
        }

        final List<AuthorizationQuery> queries = request.evaluations().stream()
                .map(request::effective)
                .map(this::toQuery)
                .toList();

        return entityResolver
                .extractEntities(request)
                .flatMap(entities -> engine.evaluateBatch(queries, entities)
                        .onFailure(EvaluationService::notDomainFailure)
                        .transform(failure -> new EvaluationFailedException(
                                "Batch evaluation of " + queries.size() + " items failed: " + failure.getMessage(),
                                failure)))
                .map(answers -> applySemantics(request, answers))
                .invoke(decisions -> decisions.forEach(d -> metrics.recordDecision(OP_EVALUATIONS, d.decision())))
                .onFailure()
                .invoke(failure -> metrics.recordFailure(OP_EVALUATIONS, failure.getClass().getSimpleName()));
    }

    private List<Decision> applySemantics(BatchEvaluationRequest request, List<DecisionAnswer> answers) {
        if (answers.size() != request.evaluations().size()) {
            throw new EvaluationFailedException("Engine returned " + answers.size() + " answers for "
                    + request.evaluations().size() + " evaluations");
        }
        final List<Decision> decisions = new ArrayList<>(answers.size());
        for (final var answer : answers) {
            decisions.add(DecisionMapper.toDecision(answer));
            if (request.semantics().stopsAfter(answer.outcome())) {
                LOG.debugf(
                        "Batch stopped after item %d of %d (%s)",
                        decisions.size(), answers.size(), request.semantics().wireName());
                break;
            }
        }
        return decisions;
    }

    AuthorizationQuery toQuery(EvaluationRequest request) {
        return new AuthorizationQuery(
                request.subject().uid(),
                EntityUid.of(actionType, request.action().name()),
                request.resource().uid(),
                request.context());
    }

    private static boolean notDomainFailure(Throwable failure) {
        return !(failure instanceof EvaluationFailedException)
                && !(failure instanceof EntityResolutionException)
                && !(failure instanceof IllegalArgumentException);
    }

    private static EvaluationFailedException evaluationFailed(AuthorizationQuery query, Throwable failure) {
        LOG.warnf(failure, "Evaluation of %s on %s failed", query.action(), query.resource());
        return new EvaluationFailedException("Evaluation failed: " + failure.getMessage(), failure);
    }
}
