package com.nosota.unipay.api.model;

/**
 * Reason attached to every ledger operation and its entries.
 * <p>
 * Internal reasons move money between accounts of the ledger, so the deltas on fund-holding
 * accounts must sum to zero. External reasons pull money in from the funding source (TOPUP)
 * or let it leave the ledger (WITHDRAWAL, BUDGET_SPEND, SUBSCRIPTION_CHARGE).
 * </p>
 */
public enum LedgerReason {
    TRANSFER(Flow.INTERNAL),
    TOPUP(Flow.INFLOW),
    WITHDRAWAL(Flow.OUTFLOW),
    BUDGET_ALLOCATE(Flow.INTERNAL),
    BUDGET_SPEND(Flow.OUTFLOW),
    ESCROW_HOLD(Flow.INTERNAL),
    ESCROW_RELEASE(Flow.INTERNAL),
    ESCROW_REFUND(Flow.INTERNAL),
    LOAN_DISBURSE(Flow.INTERNAL),
    LOAN_REPAY(Flow.INTERNAL),
    SUBSCRIPTION_CHARGE(Flow.OUTFLOW);

    public enum Flow {
        INTERNAL,
        INFLOW,
        OUTFLOW
    }

    private final Flow flow;

    LedgerReason(Flow flow) {
        this.flow = flow;
    }

    public Flow getFlow() {
        return flow;
    }
}
