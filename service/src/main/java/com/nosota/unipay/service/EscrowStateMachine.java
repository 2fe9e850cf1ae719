package com.nosota.unipay.service;

import com.nosota.unipay.api.model.EscrowStatus;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for marketplace escrow orders.
 *
 * <p>State diagram:
 * <pre>
 *   PENDING
 *      |
 *    HELD
 *      |
 *   +--+-----+
 *   |        |
 * RELEASED REFUNDED
 * </pre>
 *
 * <p>RELEASED and REFUNDED are terminal. Unlike most status checks, a repeated transition to the
 * same state is not allowed: leaving HELD must happen exactly once.
 */
@Component
public class EscrowStateMachine {

    private static final Map<EscrowStatus, Set<EscrowStatus>> ALLOWED_TRANSITIONS = Map.of(
            EscrowStatus.PENDING, EnumSet.of(EscrowStatus.HELD),
            EscrowStatus.HELD, EnumSet.of(EscrowStatus.RELEASED, EscrowStatus.REFUNDED)
    );

    public boolean isTransitionAllowed(EscrowStatus fromStatus, EscrowStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        Set<EscrowStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public void validateTransition(EscrowStatus fromStatus, EscrowStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new IllegalStateException(describe(fromStatus, toStatus));
        }
    }

    public String describe(EscrowStatus fromStatus, EscrowStatus toStatus) {
        return String.format("Invalid escrow status transition: %s → %s. Allowed from %s: %s",
                fromStatus, toStatus, fromStatus, ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()));
    }

    public boolean isFinalState(EscrowStatus status) {
        return status != null && status.isTerminal();
    }
}
