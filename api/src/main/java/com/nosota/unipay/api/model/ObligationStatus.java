package com.nosota.unipay.api.model;

/**
 * Status of a scheduled subscription payment.
 */
public enum ObligationStatus {
    /**
     * Materialized inside the scheduling horizon, waiting for its due date.
     */
    SCHEDULED,

    /**
     * Charged through the ledger.
     */
    SETTLED,

    /**
     * The charge was rejected (insufficient funds, frozen account). Not retried automatically.
     */
    FAILED,

    /**
     * The subscription was cancelled before the due date.
     */
    CANCELLED
}
