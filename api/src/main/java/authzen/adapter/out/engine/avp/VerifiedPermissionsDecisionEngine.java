package authzen.adapter.out.engine.avp;

import java.util.ArrayList;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.verifiedpermissions.VerifiedPermissionsAsyncClient;
import software.amazon.awssdk.services.verifiedpermissions.model.ActionIdentifier;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedInputItem;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedOutputItem;
import software.amazon.awssdk.services.verifiedpermissions.model.BatchIsAuthorizedRequest;
import software.amazon.awssdk.services.verifiedpermissions.model.ContextDefinition;
import software.amazon.awssdk.services.verifiedpermissions.model.Decision;
import software.amazon.awssdk.services.verifiedpermissions.model.DeterminingPolicyItem;
import software.amazon.awssdk.services.verifiedpermissions.model.EntitiesDefinition;
import software.amazon.awssdk.services.verifiedpermissions.model.EntityIdentifier;
import software.amazon.awssdk.services.verifiedpermissions.model.EvaluationErrorItem;
import software.amazon.awssdk.services.verifiedpermissions.model.IsAuthorizedRequest;

import authzen.adapter.out.entity.CedarEntityJson;
import authzen.adapter.out.threading.VertxContextHelper;
import authzen.core.exception.EvaluationFailedException;
import authzen.core.model.AuthorizationQuery;
import authzen.core.model.DecisionAnswer;
import authzen.core.model.EntityUid;
import authzen.core.model.Outcome;
import authzen.core.model.ResolvedEntity;
import authzen.core.port.out.DecisionEngine;

/**
 * Evaluates queries with Amazon Verified Permissions.
 *
 * <p>Entities and context are sent in the Cedar JSON format. Batches are split into
 * chunks of {@value #BATCH_LIMIT} requests (the service limit), sent concurrently and
 * reassembled in request order. The service requires every request of one
 * {@code BatchIsAuthorized} call to share either the principal or the resource.
 */
public class VerifiedPermissionsDecisionEngine implements DecisionEngine {

    private static final Logger LOG = Logger.getLogger(VerifiedPermissionsDecisionEngine.class);

    static final int BATCH_LIMIT = 30;

    private final VerifiedPermissionsAsyncClient client;
    private final String policyStoreId;
    private final CedarEntityJson entityJson;

    public VerifiedPermissionsDecisionEngine(
            VerifiedPermissionsAsyncClient client, String policyStoreId, CedarEntityJson entityJson) {
        this.client = client;
        this.policyStoreId = policyStoreId;
        this.entityJson = entityJson;
    }

    @Override
    public String name() {
        return "verified-permissions";
    }

    @Override
    public Uni<DecisionAnswer> evaluate(AuthorizationQuery query, List<ResolvedEntity> entities) {
        final var builder = IsAuthorizedRequest.builder()
                .policyStoreId(policyStoreId)
                .principal(identifier(query.principal()))
                .action(action(query.action()))
                .resource(identifier(query.resource()))
                .entities(entities(entities));
        if (!query.context().isEmpty()) {
            builder.context(context(query));
        }
        final var request = builder.build();

        return VertxContextHelper.fromFuture(() -> client.isAuthorized(request))
                .onFailure()
                .transform(e -> failed("IsAuthorized", e))
                .map(response -> {
                    LOG.debugf("IsAuthorized %s %s %s -> %s", query.principal(), query.action(), query.resource(),
                            response.decision());
                    return answer(response.decision(), response.determiningPolicies(), response.errors());
                });
    }

    @Override
    public Uni<List<DecisionAnswer>> evaluateBatch(List<AuthorizationQuery> queries, List<ResolvedEntity> entities) {
        if (queries.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var entitiesDefinition = entities(entities);

        final List<Uni<List<DecisionAnswer>>> chunks = new ArrayList<>();
        for (int i = 0; i < queries.size(); i += BATCH_LIMIT) {
            final var chunk = queries.subList(i, Math.min(i + BATCH_LIMIT, queries.size()));
            chunks.add(batch(chunk, entitiesDefinition));
        }

        return Uni.combine().all().unis(chunks).with(results -> {
            final List<DecisionAnswer> answers = new ArrayList<>(queries.size());
            for (final var result : results) {
                @SuppressWarnings("unchecked")
                final var chunkAnswers = (List<DecisionAnswer>) result;
                answers.addAll(chunkAnswers);
            }
            return answers;
        });
    }

    private Uni<List<DecisionAnswer>> batch(List<AuthorizationQuery> queries, EntitiesDefinition entities) {
        final List<BatchIsAuthorizedInputItem> items = queries.stream()
                .map(query -> {
                    final var item = BatchIsAuthorizedInputItem.builder()
                            .principal(identifier(query.principal()))
                            .action(action(query.action()))
                            .resource(identifier(query.resource()));
                    if (!query.context().isEmpty()) {
                        item.context(context(query));
                    }
                    return item.build();
                })
                .toList();
        final var request = BatchIsAuthorizedRequest.builder()
                .policyStoreId(policyStoreId)
                .entities(entities)
                .requests(items)
                .build();

        return VertxContextHelper.fromFuture(() -> client.batchIsAuthorized(request))
                .onFailure()
                .transform(e -> failed("BatchIsAuthorized", e))
                .map(response -> {
                    if (response.results().size() != queries.size()) {
                        throw new EvaluationFailedException("BatchIsAuthorized returned " + response.results().size()
                                + " results for " + queries.size() + " requests");
                    }
                    final List<DecisionAnswer> answers = new ArrayList<>(queries.size());
                    for (final BatchIsAuthorizedOutputItem result : response.results()) {
                        answers.add(answer(result.decision(), result.determiningPolicies(), result.errors()));
                    }
                    return answers;
                });
    }

    private static DecisionAnswer answer(
            Decision decision, List<DeterminingPolicyItem> determiningPolicies, List<EvaluationErrorItem> errors) {
        return new DecisionAnswer(
                decision == Decision.ALLOW ? Outcome.ALLOW : Outcome.DENY,
                determiningPolicies.stream().map(DeterminingPolicyItem::policyId).toList(),
                errors.stream().map(EvaluationErrorItem::errorDescription).toList());
    }

    private EntitiesDefinition entities(List<ResolvedEntity> entities) {
        return EntitiesDefinition.builder()
                .cedarJson(entityJson.toJsonString(entityJson.writeEntities(entities)))
                .build();
    }

    private ContextDefinition context(AuthorizationQuery query) {
        return ContextDefinition.builder()
                .cedarJson(entityJson.toJsonString(query.context()))
                .build();
    }

    private static EntityIdentifier identifier(EntityUid uid) {
        return EntityIdentifier.builder().entityType(uid.type()).entityId(uid.id()).build();
    }

    private static ActionIdentifier action(EntityUid uid) {
        return ActionIdentifier.builder().actionType(uid.type()).actionId(uid.id()).build();
    }

    private static EvaluationFailedException failed(String operation, Throwable e) {
        if (e instanceof EvaluationFailedException efe) {
            return efe;
        }
        LOG.warnf(e, "Verified Permissions %s failed", operation);
        return new EvaluationFailedException(operation + " failed: " + e.getMessage(), e);
    }
}
