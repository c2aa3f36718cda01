package build.acta.sdk.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestrationStateTest {

    @Test
    void happyPath_isAllowed() {
        assertTrue(OrchestrationState.IDLE.canTransitionTo(OrchestrationState.PREPARING));
        assertTrue(OrchestrationState.PREPARING.canTransitionTo(OrchestrationState.AWAITING_SIGNATURE));
        assertTrue(OrchestrationState.AWAITING_SIGNATURE.canTransitionTo(OrchestrationState.SUBMITTING));
        assertTrue(OrchestrationState.SUBMITTING.canTransitionTo(OrchestrationState.CONFIRMED));
        assertTrue(OrchestrationState.SUBMITTING.canTransitionTo(OrchestrationState.POLLING));
        assertTrue(OrchestrationState.POLLING.canTransitionTo(OrchestrationState.UNRESOLVED));
    }

    @Test
    void skippingSteps_isNotAllowed() {
        assertFalse(OrchestrationState.IDLE.canTransitionTo(OrchestrationState.SUBMITTING));
        assertFalse(OrchestrationState.PREPARING.canTransitionTo(OrchestrationState.CONFIRMED));
        assertFalse(OrchestrationState.AWAITING_SIGNATURE.canTransitionTo(OrchestrationState.POLLING));
        assertFalse(OrchestrationState.SUBMITTING.canTransitionTo(OrchestrationState.UNRESOLVED));
    }

    @ParameterizedTest
    @EnumSource(value = OrchestrationState.class, names = {"CONFIRMED", "FAILED", "UNRESOLVED"})
    void terminalStates_haveNoSuccessors(OrchestrationState state) {
        assertThat(state.isTerminalState()).isTrue();
        assertThat(state.getSuccessors()).isEmpty();
    }
}
