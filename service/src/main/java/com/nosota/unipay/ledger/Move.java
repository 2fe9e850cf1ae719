package com.nosota.unipay.ledger;

import java.math.BigDecimal;

/**
 * One signed balance change requested from the transfer engine.
 *
 * @param accountId Account to change
 * @param delta     Signed amount, never zero
 */
public record Move(Long accountId, BigDecimal delta) {

    public static Move debit(Long accountId, BigDecimal amount) {
        return new Move(accountId, amount.negate());
    }

    public static Move credit(Long accountId, BigDecimal amount) {
        return new Move(accountId, amount);
    }
}
