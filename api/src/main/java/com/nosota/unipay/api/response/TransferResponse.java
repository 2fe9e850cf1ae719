package com.nosota.unipay.api.response;

import com.nosota.unipay.api.dto.LedgerEntryDTO;
import com.nosota.unipay.api.model.LedgerReason;

import java.util.List;

/**
 * Response for any balance-moving operation.
 *
 * @param operationId Idempotence key of the operation
 * @param reason      Ledger reason
 * @param duplicate   true when the operation had already been applied and nothing changed
 * @param entries     Ledger entries written by the operation (by the first application for duplicates)
 */
public record TransferResponse(
        String operationId,
        LedgerReason reason,
        boolean duplicate,
        List<LedgerEntryDTO> entries
) {}
