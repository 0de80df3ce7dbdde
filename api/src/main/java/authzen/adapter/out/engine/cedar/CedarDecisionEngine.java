package authzen.adapter.out.engine.cedar;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.cedarpolicy.AuthorizationEngine;
import com.cedarpolicy.model.AuthorizationRequest;
import com.cedarpolicy.model.exception.AuthException;
import com.cedarpolicy.model.entity.Entity;
import com.cedarpolicy.model.policy.PolicySet;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authzen.core.exception.EvaluationFailedException;
import authzen.core.model.AuthorizationQuery;
import authzen.core.model.DecisionAnswer;
import authzen.core.model.Outcome;
import authzen.core.model.ResolvedEntity;
import authzen.core.port.out.DecisionEngine;

/**
 * Evaluates queries in-process with the Cedar Java bindings.
 *
 * <p>Reasons are the ids of the policies that determined the decision, sorted. A query
 * whose principal, action or resource type is not a valid Cedar type name (for example
 * the empty placeholder of a batch item) is denied with an error instead of failing.
 * A context Cedar cannot represent fails with {@link IllegalArgumentException}.
 */
public class CedarDecisionEngine implements DecisionEngine {

    private static final Logger LOG = Logger.getLogger(CedarDecisionEngine.class);

    private final AuthorizationEngine engine;
    private final PolicySet policies;

    public CedarDecisionEngine(AuthorizationEngine engine, PolicySet policies) {
        this.engine = engine;
        this.policies = policies;
    }

    @Override
    public String name() {
        return "cedar";
    }

    @Override
    public Uni<DecisionAnswer> evaluate(AuthorizationQuery query, List<ResolvedEntity> entities) {
        return Uni.createFrom().item(() -> decide(query, toCedarEntities(entities)));
    }

    @Override
    public Uni<List<DecisionAnswer>> evaluateBatch(List<AuthorizationQuery> queries, List<ResolvedEntity> entities) {
        return Uni.createFrom().item(() -> {
            final var cedarEntities = toCedarEntities(entities);
            final List<DecisionAnswer> answers = new ArrayList<>(queries.size());
            for (final var query : queries) {
                answers.add(decide(query, cedarEntities));
            }
            return answers;
        });
    }

    private DecisionAnswer decide(AuthorizationQuery query, Set<Entity> entities) {
        final var principal = CedarValueConverter.toUid(query.principal());
        final var action = CedarValueConverter.toUid(query.action());
        final var resource = CedarValueConverter.toUid(query.resource());
        if (principal == null || action == null || resource == null) {
            LOG.debugf("Denying query with invalid entity type: %s %s %s", query.principal(), query.action(),
                    query.resource());
            return new DecisionAnswer(
                    Outcome.DENY, List.of(), List.of("invalid entity type in principal, action or resource"));
        }

        final AuthorizationRequest request;
        try {
            request = new AuthorizationRequest(principal, action, resource, CedarValueConverter.toRecord(query.context()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid context: " + e.getMessage(), e);
        }

        try {
            final var response = engine.isAuthorized(request, policies, entities);
            if (response.success.isEmpty()) {
                LOG.warnf("Cedar returned no decision for %s %s %s", principal, action, resource);
                return new DecisionAnswer(Outcome.DENY, List.of(), List.of("cedar returned no decision"));
            }
            final var success = response.success.get();
            final List<String> reasons = new ArrayList<>(success.getReasons());
            reasons.sort(null);
            return success.isAllowed() ? DecisionAnswer.allow(reasons) : DecisionAnswer.deny(reasons);
        } catch (AuthException e) {
            throw new EvaluationFailedException("Cedar evaluation failed: " + e.getMessage(), e);
        }
    }

    private static Set<Entity> toCedarEntities(List<ResolvedEntity> entities) {
        try {
            return CedarValueConverter.toEntities(entities);
        } catch (IllegalArgumentException e) {
            throw new EvaluationFailedException("Entities cannot be converted for Cedar: " + e.getMessage(), e);
        }
    }
}
