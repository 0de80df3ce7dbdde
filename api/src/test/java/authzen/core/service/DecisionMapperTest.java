package authzen.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authzen.core.model.DecisionAnswer;

@DisplayName("DecisionMapper")
class DecisionMapperTest {

    @Test
    @DisplayName("Allow should report determining policies by position")
    void allowShouldReportPolicies() {
        final var decision = DecisionMapper.toDecision(DecisionAnswer.allow(List.of("GET-x.cedar", "GET-any.cedar")));

        assertTrue(decision.decision());
        assertEquals(Map.of("0", "GET-x.cedar", "1", "GET-any.cedar"), decision.reasonAdmin());
    }

    @Test
    @DisplayName("Allow without reasons should report no reasons")
    void allowWithoutReasons() {
        final var decision = DecisionMapper.toDecision(DecisionAnswer.allow(List.of()));

        assertTrue(decision.decision());
        assertFalse(decision.hasReasons());
    }

    @Test
    @DisplayName("Deny without reasons should report the default deny")
    void denyWithoutReasons() {
        final var decision = DecisionMapper.toDecision(DecisionAnswer.deny(List.of()));

        assertFalse(decision.decision());
        assertEquals(Map.of("0", DecisionMapper.DEFAULT_DENY_REASON), decision.reasonAdmin());
    }

    @Test
    @DisplayName("Deny from a forbid policy should report that policy")
    void denyWithForbid() {
        final var decision = DecisionMapper.toDecision(DecisionAnswer.deny(List.of("forbid-archived.cedar")));

        assertFalse(decision.decision());
        assertEquals(Map.of("0", "forbid-archived.cedar"), decision.reasonAdmin());
    }
}
