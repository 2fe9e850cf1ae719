package com.nosota.unipay.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nosota.unipay.api.model.LedgerErrorCode;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Error body returned for rejected operations.
 * <p>
 * Amount fields are filled wherever the rejection concerns an amount, so the caller can
 * tell the user by how much the request exceeded what was available.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerErrorResponse(
        LocalDateTime timestamp,
        int status,
        LedgerErrorCode code,
        String message,
        Long accountId,
        BigDecimal requested,
        BigDecimal available,
        BigDecimal shortfall,
        String path,
        String correlationId
) {}
