package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The operation being authorized.
 *
 * <p>Properties are accepted for protocol compatibility. Cedar actions cannot carry
 * request-time attributes, so they are not forwarded to the decision engine.
 *
 * @param name       the action name (e.g., "GET", "can_read_todos")
 * @param properties optional action properties
 */
public record Action(String name, Map<String, Object> properties) {

    private static final Action PLACEHOLDER = new Action("", null);

    public Action {
        if (name == null) {
            throw new IllegalArgumentException("Action name cannot be null");
        }
        if (properties != null) {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    public static Action named(String name) {
        return new Action(name, null);
    }

    public static Action placeholder() {
        return PLACEHOLDER;
    }
}
