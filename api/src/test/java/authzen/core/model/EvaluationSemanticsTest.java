package authzen.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EvaluationSemantics")
class EvaluationSemanticsTest {

    @Test
    @DisplayName("Should parse protocol names")
    void shouldParseWireNames() {
        assertEquals(EvaluationSemantics.EXECUTE_ALL, EvaluationSemantics.fromWireName(null));
        assertEquals(EvaluationSemantics.DENY_ON_FIRST_DENY, EvaluationSemantics.fromWireName("deny_on_first_deny"));
        assertEquals(
                EvaluationSemantics.PERMIT_ON_FIRST_PERMIT, EvaluationSemantics.fromWireName("permit_on_first_permit"));
        assertThrows(IllegalArgumentException.class, () -> EvaluationSemantics.fromWireName("DENY_ON_FIRST_DENY"));
    }

    @Test
    @DisplayName("Should stop only on the triggering outcome")
    void shouldStopOnTriggeringOutcome() {
        assertFalse(EvaluationSemantics.EXECUTE_ALL.stopsAfter(Outcome.DENY));
        assertTrue(EvaluationSemantics.DENY_ON_FIRST_DENY.stopsAfter(Outcome.DENY));
        assertFalse(EvaluationSemantics.DENY_ON_FIRST_DENY.stopsAfter(Outcome.ALLOW));
        assertTrue(EvaluationSemantics.PERMIT_ON_FIRST_PERMIT.stopsAfter(Outcome.ALLOW));
        assertFalse(EvaluationSemantics.PERMIT_ON_FIRST_PERMIT.stopsAfter(Outcome.DENY));
    }
}
