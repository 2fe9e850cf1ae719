package com.nosota.unipay.api.request;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Request for opening a new wallet for the calling owner.
 *
 * @param name     Optional label of the wallet
 * @param currency ISO 4217 currency code, USD when omitted
 */
public record OpenWalletRequest(
        @Size(max = 100, message = "Name must be at most 100 characters")
        String name,

        @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
        String currency
) {
}
