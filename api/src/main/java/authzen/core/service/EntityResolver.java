package authzen.core.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authzen.core.exception.EntityResolutionException;
import authzen.core.model.BatchEvaluationRequest;
import authzen.core.model.Entity;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;
import authzen.core.port.out.EntityProvider;

/**
 * Builds the entity set handed to the decision engine.
 *
 * <p>Entities that carry inline properties are trusted as-is and never looked up.
 * All other entities are fetched from the {@link EntityProvider} in a single call.
 * The result never contains two entities with the same key; when an entity appears
 * both inline and fetched, the inline version wins.
 */
@ApplicationScoped
public class EntityResolver {

    private static final Logger LOG = Logger.getLogger(EntityResolver.class);

    private final EntityProvider provider;

    @Inject
    public EntityResolver(EntityProvider provider) {
        this.provider = provider;
    }

    /**
     * Resolve request entities.
     *
     * @param entities subjects and resources in request order; repeats are allowed
     * @return Uni with the deduplicated entity set
     */
    public Uni<List<ResolvedEntity>> determineEntities(List<Entity> entities) {
        final Map<String, ResolvedEntity> inline = new LinkedHashMap<>();
        final Map<String, EntityUid> undetermined = new LinkedHashMap<>();

        for (final var entity : entities) {
            if (entity.hasProperties()) {
                inline.putIfAbsent(entity.uid().key(), ResolvedEntity.fromInline(entity));
            }
        }
        for (final var entity : entities) {
            final var key = entity.uid().key();
            if (!entity.hasProperties() && !inline.containsKey(key)) {
                undetermined.putIfAbsent(key, entity.uid());
            }
        }

        if (undetermined.isEmpty()) {
            return Uni.createFrom().item(List.copyOf(inline.values()));
        }

        final var lookup = List.copyOf(undetermined.values());
        LOG.debugf("Resolving %d entities inline, fetching %d from provider", inline.size(), lookup.size());

        return provider.findEntities(lookup)
                .onFailure(failure -> !(failure instanceof EntityResolutionException))
                .transform(failure -> new EntityResolutionException(
                        "Failed to resolve entities " + lookup + ": " + failure.getMessage(), failure))
                .map(fetched -> merge(inline, fetched));
    }

    /**
     * Resolve every entity a batch refers to with one provider lookup.
     *
     * @param request the batch
     * @return Uni with the entity set shared by all items of the batch
     */
    public Uni<List<ResolvedEntity>> extractEntities(BatchEvaluationRequest request) {
        return determineEntities(request.referencedEntities());
    }

    private static List<ResolvedEntity> merge(Map<String, ResolvedEntity> inline, List<ResolvedEntity> fetched) {
        final Map<String, ResolvedEntity> merged = new LinkedHashMap<>(inline);
        for (final var entity : fetched) {
            merged.putIfAbsent(entity.key(), entity);
        }
        return new ArrayList<>(merged.values());
    }
}
