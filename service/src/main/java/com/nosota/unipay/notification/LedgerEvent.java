package com.nosota.unipay.notification;

import java.math.BigDecimal;

/**
 * Something a user should be told about, published after the ledger change is committed.
 *
 * @param type      What happened
 * @param ownerId   Recipient
 * @param accountId Account concerned
 * @param reference Operation id, order id or obligation id the event refers to
 * @param amount    Amount moved (or attempted)
 * @param message   Human readable summary
 */
public record LedgerEvent(
        LedgerEventType type,
        Long ownerId,
        Long accountId,
        String reference,
        BigDecimal amount,
        String message
) {
}
