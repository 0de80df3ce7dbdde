package authzen.core.model.search;

import java.util.Map;

import authzen.core.model.Entity;

/**
 * Which actions may a subject perform on a resource?
 *
 * @param subject  the subject
 * @param resource the resource
 * @param context  request context
 * @param page     paging parameters
 */
public record ActionSearchRequest(Entity subject, Entity resource, Map<String, Object> context, PageRequest page) {

    public ActionSearchRequest {
        if (subject == null || resource == null) {
            throw new IllegalArgumentException("subject and resource are required");
        }
        context = context == null ? Map.of() : context;
        page = page == null ? PageRequest.first() : page;
    }
}
