package authzen.core.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import authzen.core.model.Decision;
import authzen.core.model.DecisionAnswer;

/**
 * Maps engine answers to protocol decisions.
 *
 * <p>Reasons are reported under {@code reason_admin}, keyed by position. A deny without
 * determining policies reports {@link #DEFAULT_DENY_REASON} under key "0".
 */
public final class DecisionMapper {

    public static final String DEFAULT_DENY_REASON = "deny by default";

    private DecisionMapper() {}

    public static Decision toDecision(DecisionAnswer answer) {
        if (answer.allowed()) {
            return Decision.permit(indexed(answer.reasons()));
        }
        if (answer.reasons().isEmpty()) {
            return Decision.deny(Map.of("0", DEFAULT_DENY_REASON));
        }
        return Decision.deny(indexed(answer.reasons()));
    }

    private static Map<String, String> indexed(List<String> reasons) {
        final Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < reasons.size(); i++) {
            result.put(String.valueOf(i), reasons.get(i));
        }
        return result;
    }
}
