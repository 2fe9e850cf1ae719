package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Peer-to-peer transfer between two wallets.
 *
 * @param operationId   Client supplied idempotence key
 * @param fromAccountId Wallet to debit (must belong to the caller)
 * @param toAccountId   Wallet to credit
 * @param amount        Amount to transfer (positive)
 */
public record TransferRequest(
        @NotBlank(message = "Operation ID is required")
        @Size(max = 64, message = "Operation ID must be at most 64 characters")
        String operationId,

        @NotNull(message = "Sender account ID is required")
        Long fromAccountId,

        @NotNull(message = "Recipient account ID is required")
        Long toAccountId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount
) {
}
