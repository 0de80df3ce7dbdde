package authzen.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import authzen.core.model.AuthorizationQuery;
import authzen.core.model.DecisionAnswer;
import authzen.core.model.ResolvedEntity;

/**
 * Port for the backing policy engine.
 *
 * <p>The engine owns its policy set; it is loaded once when the engine is created and
 * never changes afterwards.
 */
public interface DecisionEngine {

    /**
     * Short engine name for logs and metrics (e.g., "cedar").
     */
    String name();

    /**
     * Answer one authorization query.
     *
     * @param query    the query
     * @param entities every entity the policies may reference, without duplicates
     * @return Uni with the answer
     */
    Uni<DecisionAnswer> evaluate(AuthorizationQuery query, List<ResolvedEntity> entities);

    /**
     * Answer several queries against one shared entity set.
     *
     * @param queries  the queries
     * @param entities entities shared by all queries, without duplicates
     * @return Uni with answers aligned with {@code queries}
     */
    Uni<List<DecisionAnswer>> evaluateBatch(List<AuthorizationQuery> queries, List<ResolvedEntity> entities);
}
