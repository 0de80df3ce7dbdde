package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An entity with everything the decision engine needs: attributes, parents and tags.
 *
 * <p>Instances are immutable. Attribute values follow the Cedar JSON entity format
 * (strings, numbers, booleans, lists, records, {@code __entity} references and
 * {@code __extn} extension values).
 *
 * @param uid     the entity identity
 * @param attrs   attribute values
 * @param parents direct parents (groups, containers)
 * @param tags    entity tags, empty when the entity has none
 */
public record ResolvedEntity(EntityUid uid, Map<String, Object> attrs, List<EntityUid> parents, Map<String, Object> tags) {

    public ResolvedEntity {
        if (uid == null) {
            throw new IllegalArgumentException("Entity uid cannot be null");
        }
        attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
        parents = parents == null ? List.of() : List.copyOf(parents);
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public ResolvedEntity(EntityUid uid, Map<String, Object> attrs, List<EntityUid> parents) {
        this(uid, attrs, parents, null);
    }

    /**
     * Build a resolved entity from attributes supplied inline in a request.
     *
     * <p>Inline entities never have parents.
     *
     * @param entity request entity carrying properties
     * @return the resolved entity
     */
    public static ResolvedEntity fromInline(Entity entity) {
        return new ResolvedEntity(entity.uid(), entity.properties(), List.of(), null);
    }

    public String key() {
        return uid.key();
    }
}
