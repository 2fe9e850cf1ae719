package com.nosota.unipay.service;

import com.nosota.unipay.api.model.EscrowStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Escrow state machine")
class EscrowStateMachineTest {

    private final EscrowStateMachine stateMachine = new EscrowStateMachine();

    @Test
    @DisplayName("PENDING → HELD → RELEASED | REFUNDED are the only transitions")
    void allowedTransitions() {
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.PENDING, EscrowStatus.HELD)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.HELD, EscrowStatus.RELEASED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.HELD, EscrowStatus.REFUNDED)).isTrue();

        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.PENDING, EscrowStatus.RELEASED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.HELD, EscrowStatus.HELD)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.RELEASED, EscrowStatus.REFUNDED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(EscrowStatus.REFUNDED, EscrowStatus.RELEASED)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(null, EscrowStatus.HELD)).isFalse();
    }

    @Test
    @DisplayName("Resolved orders are final")
    void terminalStates() {
        assertThat(stateMachine.isFinalState(EscrowStatus.RELEASED)).isTrue();
        assertThat(stateMachine.isFinalState(EscrowStatus.REFUNDED)).isTrue();
        assertThat(stateMachine.isFinalState(EscrowStatus.HELD)).isFalse();
        assertThat(stateMachine.isFinalState(EscrowStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("Invalid transition is rejected with the allowed targets")
    void validateRejects() {
        assertThatThrownBy(() -> stateMachine.validateTransition(EscrowStatus.RELEASED, EscrowStatus.REFUNDED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RELEASED → REFUNDED");
    }
}
