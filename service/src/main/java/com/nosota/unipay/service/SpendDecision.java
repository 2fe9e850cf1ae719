package com.nosota.unipay.service;

import com.nosota.unipay.api.model.SpendConstraint;

import java.math.BigDecimal;

/**
 * Answer of the budget card spend guard.
 *
 * @param allowed    whether the spend may proceed
 * @param constraint the constraint that rejected it, NONE when allowed
 * @param message    user-facing explanation naming the constraint and the excess
 * @param shortfall  amount by which the spend exceeds the binding constraint
 * @param available  what the binding constraint still allows
 */
public record SpendDecision(
        boolean allowed,
        SpendConstraint constraint,
        String message,
        BigDecimal shortfall,
        BigDecimal available
) {

    static SpendDecision allow() {
        return new SpendDecision(true, SpendConstraint.NONE, "Spend allowed", BigDecimal.ZERO, null);
    }
}
