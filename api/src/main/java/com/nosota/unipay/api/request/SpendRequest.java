package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Purchase paid from a budget card.
 *
 * @param operationId Client supplied idempotence key
 * @param amount      Purchase amount
 * @param description Optional merchant / purchase description
 */
public record SpendRequest(
        @NotBlank(message = "Operation ID is required")
        @Size(max = 64, message = "Operation ID must be at most 64 characters")
        String operationId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @Size(max = 255, message = "Description must be at most 255 characters")
        String description
) {
}
