package authzen.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import authzen.core.exception.UnsupportedSearchException;
import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

/**
 * Port for the policy information point: the store of entity attributes and parents.
 */
public interface EntityProvider {

    /**
     * Find entities and their ancestors.
     *
     * <p>The result contains each stored entity among {@code uids} and its parents,
     * transitively up to the provider's configured depth. No entity appears twice.
     * Unknown uids are omitted.
     *
     * @param uids entities to look up
     * @return Uni with the entities found
     */
    Uni<List<ResolvedEntity>> findEntities(List<EntityUid> uids);

    /**
     * Enumerate the ids of all stored entities of a type.
     *
     * @param entityType the entity type
     * @return Uni with ids in store order
     */
    default Uni<List<String>> scanEntities(String entityType) {
        return Uni.createFrom()
                .failure(new UnsupportedSearchException(getClass().getSimpleName() + " cannot enumerate entities"));
    }

    /**
     * Actions the loaded schema declares for a principal type and resource type.
     *
     * @param principalType the subject's entity type
     * @param resourceType  the resource's entity type
     * @return Uni with action names, empty when no schema is loaded
     */
    Uni<List<String>> findApplicableActions(String principalType, String resourceType);
}
