package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The part of a Cedar schema the PDP needs: for each action of the schema's namespace,
 * the principal and resource types it applies to.
 *
 * @param namespace the schema namespace ("" for the empty namespace)
 * @param actions   action name to applicable types, in schema order
 */
public record CedarSchema(String namespace, Map<String, AppliesTo> actions) {

    private static final CedarSchema EMPTY = new CedarSchema("", Map.of());

    public CedarSchema {
        namespace = namespace == null ? "" : namespace;
        actions = actions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    /**
     * Schema used when none is configured; it declares no actions.
     */
    public static CedarSchema empty() {
        return EMPTY;
    }

    /**
     * Actions applicable to a principal type and a resource type.
     *
     * @param principalType the subject's entity type
     * @param resourceType  the resource's entity type
     * @return action names in schema order
     */
    public List<String> applicableActions(String principalType, String resourceType) {
        return actions.entrySet().stream()
                .filter(e -> e.getValue().principalTypes().contains(principalType)
                        && e.getValue().resourceTypes().contains(resourceType))
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Principal and resource types of one action.
     *
     * @param principalTypes entity types allowed as principal
     * @param resourceTypes  entity types allowed as resource
     */
    public record AppliesTo(Set<String> principalTypes, Set<String> resourceTypes) {

        public AppliesTo {
            principalTypes = principalTypes == null ? Set.of() : Set.copyOf(principalTypes);
            resourceTypes = resourceTypes == null ? Set.of() : Set.copyOf(resourceTypes);
        }
    }
}
