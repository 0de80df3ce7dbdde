package authzen.core.model;

import java.util.Arrays;

/**
 * Short-circuit policy for batch evaluations.
 */
public enum EvaluationSemantics {

    /** Evaluate and report every item. */
    EXECUTE_ALL("execute_all"),

    /** Stop after the first deny; the deny is the last reported decision. */
    DENY_ON_FIRST_DENY("deny_on_first_deny"),

    /** Stop after the first permit; the permit is the last reported decision. */
    PERMIT_ON_FIRST_PERMIT("permit_on_first_permit");

    private final String wireName;

    EvaluationSemantics(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Whether a batch must stop once an item with the given outcome has been reported.
     *
     * @param outcome outcome of the item just reported
     * @return true if no further items are reported
     */
    public boolean stopsAfter(Outcome outcome) {
        return switch (this) {
            case EXECUTE_ALL -> false;
            case DENY_ON_FIRST_DENY -> outcome == Outcome.DENY;
            case PERMIT_ON_FIRST_PERMIT -> outcome == Outcome.ALLOW;
        };
    }

    /**
     * Parse the protocol name of a semantics value.
     *
     * @param value protocol value, e.g. "deny_on_first_deny"; null selects {@link #EXECUTE_ALL}
     * @return the matching semantics
     * @throws IllegalArgumentException if the value is not a known semantics
     */
    public static EvaluationSemantics fromWireName(String value) {
        if (value == null) {
            return EXECUTE_ALL;
        }
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown evaluation_semantics: " + value));
    }
}
