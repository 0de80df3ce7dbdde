package authzen.core.model.search;

import java.util.Map;

import authzen.core.model.Action;
import authzen.core.model.Entity;

/**
 * Which subjects of a type may perform an action on a resource?
 *
 * @param subjectType type of the subjects to enumerate
 * @param action      the action
 * @param resource    the resource
 * @param context     request context
 * @param page        paging parameters
 */
public record SubjectSearchRequest(
        String subjectType, Action action, Entity resource, Map<String, Object> context, PageRequest page) {

    public SubjectSearchRequest {
        if (subjectType == null || subjectType.isBlank()) {
            throw new IllegalArgumentException("subject.type is required");
        }
        if (action == null || resource == null) {
            throw new IllegalArgumentException("action and resource are required");
        }
        context = context == null ? Map.of() : context;
        page = page == null ? PageRequest.first() : page;
    }
}
