package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request moving money between an account and the external funding source
 * (top-up, withdrawal) or between a wallet and one of its budget cards.
 *
 * @param operationId Client supplied idempotence key of the operation
 * @param amount      Amount to move (positive)
 */
public record FundsRequest(
        @NotBlank(message = "Operation ID is required")
        @Size(max = 64, message = "Operation ID must be at most 64 characters")
        String operationId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount
) {
}
