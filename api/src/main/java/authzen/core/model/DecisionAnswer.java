package authzen.core.model;

import java.util.List;

/**
 * Normalized answer of a decision engine for one authorization query.
 *
 * @param outcome allow or deny
 * @param reasons ids of the policies that determined the outcome (or the engine's
 *                diagnostic reasons), in the order the engine reported them
 * @param errors  evaluation errors reported alongside the outcome
 */
public record DecisionAnswer(Outcome outcome, List<String> reasons, List<String> errors) {

    public DecisionAnswer {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DecisionAnswer allow(List<String> reasons) {
        return new DecisionAnswer(Outcome.ALLOW, reasons, List.of());
    }

    public static DecisionAnswer deny(List<String> reasons) {
        return new DecisionAnswer(Outcome.DENY, reasons, List.of());
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOW;
    }
}
