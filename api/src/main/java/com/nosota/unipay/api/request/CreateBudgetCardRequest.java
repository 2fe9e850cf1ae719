package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request for a new budget card funded from one of the caller's wallets.
 *
 * @param walletId     Funding wallet
 * @param name         Card label ("Groceries", "Transport")
 * @param monthlyLimit Optional monthly spending limit
 */
public record CreateBudgetCardRequest(
        @NotNull(message = "Wallet ID is required")
        Long walletId,

        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @PositiveOrZero(message = "Monthly limit must not be negative")
        BigDecimal monthlyLimit
) {
}
