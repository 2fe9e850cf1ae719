package com.nosota.unipay.error;

/**
 * The relational store could not be reached. Not retried by the ledger.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
