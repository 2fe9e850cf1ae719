package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Loan disbursement from the caller's wallet to a borrower wallet.
 *
 * @param operationId       Client supplied idempotence key
 * @param lenderAccountId   Wallet of the lender (the caller)
 * @param borrowerAccountId Wallet of the borrower
 * @param principal         Amount lent
 */
public record LoanDisbursementRequest(
        @NotBlank(message = "Operation ID is required")
        @Size(max = 64, message = "Operation ID must be at most 64 characters")
        String operationId,

        @NotNull(message = "Lender account ID is required")
        Long lenderAccountId,

        @NotNull(message = "Borrower account ID is required")
        Long borrowerAccountId,

        @NotNull(message = "Principal is required")
        @Positive(message = "Principal must be positive")
        BigDecimal principal
) {
}
