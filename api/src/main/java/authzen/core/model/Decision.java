package authzen.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol-level result of an access evaluation.
 *
 * @param decision    true when access is granted
 * @param reasonAdmin administrator-facing reasons keyed by position ("0", "1", ...);
 *                    empty when there is nothing to report
 */
public record Decision(boolean decision, Map<String, String> reasonAdmin) {

    public Decision {
        reasonAdmin = reasonAdmin == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(reasonAdmin));
    }

    public static Decision permit(Map<String, String> reasonAdmin) {
        return new Decision(true, reasonAdmin);
    }

    public static Decision deny(Map<String, String> reasonAdmin) {
        return new Decision(false, reasonAdmin);
    }

    public boolean hasReasons() {
        return !reasonAdmin.isEmpty();
    }
}
