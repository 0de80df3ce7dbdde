package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single access evaluation: may {@code subject} perform {@code action} on {@code resource}?
 *
 * @param subject  the subject (principal)
 * @param action   the action
 * @param resource the resource
 * @param context  request context, empty when absent
 */
public record EvaluationRequest(Entity subject, Action action, Entity resource, Map<String, Object> context) {

    public EvaluationRequest {
        if (subject == null) {
            throw new IllegalArgumentException("subject is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
        if (resource == null) {
            throw new IllegalArgumentException("resource is required");
        }
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public EvaluationRequest(Entity subject, Action action, Entity resource) {
        this(subject, action, resource, null);
    }
}
