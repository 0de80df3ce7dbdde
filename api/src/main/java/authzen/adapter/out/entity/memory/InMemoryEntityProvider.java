package authzen.adapter.out.entity.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;

import authzen.core.model.CedarSchema;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;
import authzen.core.port.out.EntityProvider;
import authzen.core.service.ParentClosure;

/**
 * Entity provider over an entity set loaded once at startup.
 *
 * <p>The index is built in the constructor and never modified, so lookups need no
 * synchronization. A later entity with the same uid replaces an earlier one.
 */
public class InMemoryEntityProvider implements EntityProvider {

    private final Map<String, ResolvedEntity> byKey = new HashMap<>();
    private final Map<String, List<String>> idsByType = new LinkedHashMap<>();
    private final CedarSchema schema;
    private final ParentClosure closure;

    public InMemoryEntityProvider(List<ResolvedEntity> entities, CedarSchema schema, int maxParentHops) {
        for (final var entity : entities) {
            if (byKey.put(entity.key(), entity) == null) {
                idsByType.computeIfAbsent(entity.uid().type(), t -> new ArrayList<>()).add(entity.uid().id());
            }
        }
        this.schema = schema;
        this.closure = new ParentClosure(this::lookup, maxParentHops);
    }

    @Override
    public Uni<List<ResolvedEntity>> findEntities(List<EntityUid> uids) {
        return closure.resolve(uids);
    }

    @Override
    public Uni<List<String>> scanEntities(String entityType) {
        return Uni.createFrom().item(() -> List.copyOf(idsByType.getOrDefault(entityType, List.of())));
    }

    @Override
    public Uni<List<String>> findApplicableActions(String principalType, String resourceType) {
        return Uni.createFrom().item(() -> schema.applicableActions(principalType, resourceType));
    }

    public int size() {
        return byKey.size();
    }

    private Uni<Map<String, ResolvedEntity>> lookup(List<EntityUid> uids) {
        return Uni.createFrom().item(() -> {
            final Map<String, ResolvedEntity> found = new HashMap<>();
            for (final var uid : uids) {
                final var entity = byKey.get(uid.key());
                if (entity != null) {
                    found.put(uid.key(), entity);
                }
            }
            return found;
        });
    }
}
