package com.nosota.unipay.api.response;

import com.nosota.unipay.api.model.SpendConstraint;

import java.math.BigDecimal;

/**
 * Outcome of a budget card spend authorization.
 *
 * @param allowed    Whether the spend passes every configured constraint
 * @param constraint Constraint that rejected the spend, NONE when allowed
 * @param message    Human readable reason
 * @param shortfall  Amount by which the request exceeds the binding constraint, zero when allowed
 */
public record SpendDecisionResponse(
        boolean allowed,
        SpendConstraint constraint,
        String message,
        BigDecimal shortfall
) {}
