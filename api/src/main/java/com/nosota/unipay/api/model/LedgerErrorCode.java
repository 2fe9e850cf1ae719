package com.nosota.unipay.api.model;

/**
 * Typed outcome codes of ledger operations.
 */
public enum LedgerErrorCode {
    INSUFFICIENT_FUNDS,
    ACCOUNT_FROZEN,
    ACCOUNT_NOT_FOUND,
    INVALID_STATE_TRANSITION,
    UNAUTHORIZED,

    /**
     * Row lock could not be acquired within the configured wait. Retryable.
     */
    LOCK_TIMEOUT,

    /**
     * The operation id was already applied. Treated as success by callers.
     */
    DUPLICATE_OPERATION,

    /**
     * The relational store could not be reached. Fatal for the request.
     */
    STORE_UNAVAILABLE,

    LISTING_UNAVAILABLE,

    /**
     * A configured limit (budget card monthly limit, loan outstanding) would be exceeded.
     */
    LIMIT_EXCEEDED,

    INVALID_REQUEST
}
