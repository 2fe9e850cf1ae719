package com.nosota.unipay.api.response;

/**
 * Result of executing due subscription payments.
 *
 * @param settled  Obligations charged successfully
 * @param failed   Obligations rejected and marked FAILED
 * @param deferred Obligations left SCHEDULED because of a lock timeout
 */
public record ExecutionReportResponse(
        int settled,
        int failed,
        int deferred
) {}
