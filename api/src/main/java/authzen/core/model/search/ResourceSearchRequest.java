package authzen.core.model.search;

import java.util.Map;

import authzen.core.model.Action;
import authzen.core.model.Entity;

/**
 * Which resources of a type may a subject perform an action on?
 *
 * @param subject      the subject
 * @param action       the action
 * @param resourceType type of the resources to enumerate
 * @param context      request context
 * @param page         paging parameters
 */
public record ResourceSearchRequest(
        Entity subject, Action action, String resourceType, Map<String, Object> context, PageRequest page) {

    public ResourceSearchRequest {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resource.type is required");
        }
        if (subject == null || action == null) {
            throw new IllegalArgumentException("subject and action are required");
        }
        context = context == null ? Map.of() : context;
        page = page == null ? PageRequest.first() : page;
    }
}
