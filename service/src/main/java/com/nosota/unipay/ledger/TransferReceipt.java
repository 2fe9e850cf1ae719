package com.nosota.unipay.ledger;

import com.nosota.unipay.api.model.LedgerReason;
import com.nosota.unipay.model.LedgerEntry;

import java.util.List;

/**
 * Entries written by an applied operation.
 *
 * @param operationId Idempotence key
 * @param reason      Ledger reason of the operation
 * @param duplicate   true when the operation had been applied before and nothing changed now
 * @param entries     Entries of the (first) application, in lock order
 */
public record TransferReceipt(
        String operationId,
        LedgerReason reason,
        boolean duplicate,
        List<LedgerEntry> entries
) {
}
