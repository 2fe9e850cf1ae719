package com.nosota.unipay.api.model;

/**
 * Lifecycle status of an account. Only ACTIVE accounts take part in transfers.
 */
public enum AccountStatus {
    ACTIVE,
    FROZEN,
    CLOSED
}
