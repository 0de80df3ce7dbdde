package authzen.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import authzen.core.model.Decision;

/**
 * AuthZEN decision: {@code {"decision": true, "context": {"reason_admin": {...}}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionDto(boolean decision, DecisionContextDto context) {

    public static DecisionDto fromModel(Decision decision) {
        return new DecisionDto(
                decision.decision(), decision.hasReasons() ? new DecisionContextDto(decision.reasonAdmin()) : null);
    }

    /**
     * Decision context carrying administrator-facing reasons.
     */
    public record DecisionContextDto(@JsonProperty("reason_admin") Map<String, String> reasonAdmin) {}
}
