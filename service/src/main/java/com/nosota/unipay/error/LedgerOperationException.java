package com.nosota.unipay.error;

import com.nosota.unipay.ledger.LedgerFailure;
import lombok.Getter;

/**
 * Thrown at the HTTP boundary when a ledger operation was rejected.
 * Translated to an error response by the global exception handler.
 */
@Getter
public class LedgerOperationException extends RuntimeException {

    private final LedgerFailure failure;

    public LedgerOperationException(LedgerFailure failure) {
        super(failure.message());
        this.failure = failure;
    }
}
