package com.nosota.unipay.api;

/**
 * HTTP headers shared by every UniPay API.
 */
public final class LedgerHeaders {

    /**
     * Verified owner id of the caller, set by the authentication layer in front of the service.
     */
    public static final String OWNER_ID = "X-Owner-Id";

    private LedgerHeaders() {
    }
}
