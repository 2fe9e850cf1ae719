package com.nosota.unipay.api.model;

/**
 * Constraint that bound a budget card spend decision.
 */
public enum SpendConstraint {
    NONE,
    ALLOCATED_BALANCE,
    MONTHLY_LIMIT
}
