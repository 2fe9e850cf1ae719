package com.nosota.unipay.api.model;

/**
 * Status of a marketplace escrow order.
 *
 * <pre>
 *   PENDING ──► HELD ──► RELEASED
 *                 │
 *                 └────► REFUNDED
 * </pre>
 *
 * RELEASED and REFUNDED are terminal.
 */
public enum EscrowStatus {
    /**
     * Order created, buyer funds not moved yet.
     */
    PENDING,

    /**
     * Buyer funds sit in the order's escrow account.
     */
    HELD,

    /**
     * Escrow paid out to the seller.
     */
    RELEASED,

    /**
     * Escrow returned to the buyer.
     */
    REFUNDED;

    public boolean isTerminal() {
        return this == RELEASED || this == REFUNDED;
    }
}
