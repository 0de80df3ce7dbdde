package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A subject or resource as it appears in an AuthZEN request.
 *
 * <p>When {@code properties} is present the caller supplied the entity's attributes
 * inline and they are used as-is. When it is absent ({@code null}) the attributes and
 * parents are looked up through the configured entity provider.
 *
 * @param type       the entity type
 * @param id         the entity id
 * @param properties inline attributes, or null when they must be resolved
 */
public record Entity(String type, String id, Map<String, Object> properties) {

    private static final Entity PLACEHOLDER = new Entity("", "", null);

    public Entity {
        if (type == null) {
            throw new IllegalArgumentException("Entity type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("Entity id cannot be null");
        }
        if (properties != null) {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    public static Entity of(String type, String id) {
        return new Entity(type, id, null);
    }

    public static Entity withProperties(String type, String id, Map<String, Object> properties) {
        return new Entity(type, id, properties != null ? properties : Map.of());
    }

    /**
     * Empty entity used when neither a batch item nor the batch defaults name one.
     */
    public static Entity placeholder() {
        return PLACEHOLDER;
    }

    public EntityUid uid() {
        return new EntityUid(type, id);
    }

    public boolean hasProperties() {
        return properties != null;
    }
}
