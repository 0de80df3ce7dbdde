package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One engine-level authorization question, with the action already expressed as an
 * entity UID (e.g. {@code Action::"GET"}).
 *
 * @param principal the principal
 * @param action    the action UID
 * @param resource  the resource
 * @param context   the request context
 */
public record AuthorizationQuery(EntityUid principal, EntityUid action, EntityUid resource, Map<String, Object> context) {

    public AuthorizationQuery {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
