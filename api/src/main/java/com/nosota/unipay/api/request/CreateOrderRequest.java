package com.nosota.unipay.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Buyer commitment to a marketplace listing.
 *
 * @param buyerAccountId Wallet of the buyer funding the escrow
 * @param listingId      Listing identifier in the marketplace catalog
 * @param amount         Amount to hold in escrow
 */
public record CreateOrderRequest(
        @NotNull(message = "Buyer account ID is required")
        Long buyerAccountId,

        @NotBlank(message = "Listing ID is required")
        String listingId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount
) {
}
