package com.nosota.unipay.error;

/**
 * Signals a LOCK_TIMEOUT result to the retry template so the operation is attempted again.
 */
public class LockContentionException extends RuntimeException {

    public LockContentionException(String message) {
        super(message, null, false, false);
    }
}
