package com.nosota.unipay.controller;

import com.nosota.unipay.api.response.TransferResponse;
import com.nosota.unipay.ledger.LedgerResult;
import com.nosota.unipay.ledger.TransferReceipt;
import com.nosota.unipay.mapper.LedgerEntryMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps transfer results to HTTP: 201 for a newly applied operation, 200 for a repeated one.
 * Failures are thrown as {@link com.nosota.unipay.error.LedgerOperationException}.
 */
final class TransferResponses {

    private TransferResponses() {
    }

    static ResponseEntity<TransferResponse> of(LedgerResult<TransferReceipt> result) {
        TransferReceipt receipt = result.orElseThrow();
        TransferResponse body = new TransferResponse(receipt.operationId(), receipt.reason(),
                result.isDuplicate(), LedgerEntryMapper.INSTANCE.toDTOList(receipt.entries()));
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED).body(body);
    }
}
