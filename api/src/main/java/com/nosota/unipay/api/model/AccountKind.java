package com.nosota.unipay.api.model;

/**
 * Kind of a balance-bearing account.
 * <p>
 * WALLET, BUDGET_CARD and ESCROW accounts can never go negative.
 * LOAN accounts carry the outstanding principal of a loan as a memo figure:
 * the money itself already sits in the borrower wallet.
 * </p>
 */
public enum AccountKind {
    /**
     * Primary wallet of a user.
     */
    WALLET,

    /**
     * Budget sub-card funded from a wallet. May carry a monthly spending limit.
     */
    BUDGET_CARD,

    /**
     * System-owned hold for a single marketplace order.
     */
    ESCROW,

    /**
     * Outstanding principal of a loan between two wallets.
     */
    LOAN;

    /**
     * @return true if the ledger must keep the balance of this kind at or above zero
     */
    public boolean isNonNegative() {
        return this != LOAN;
    }

    /**
     * @return true if the balance is real money (counted by reconciliation)
     */
    public boolean holdsFunds() {
        return this != LOAN;
    }
}
