package com.nosota.unipay.api.request;

import com.nosota.unipay.api.model.BillingCycle;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request for a recurring subscription paid from a budget card or wallet.
 *
 * @param accountId        Paying account
 * @param serviceName      Name of the subscribed service
 * @param serviceCategory  Optional category ("streaming", "software")
 * @param amount           Amount charged every cycle
 * @param billingCycle     Billing cycle, MONTHLY when omitted
 * @param firstBillingDate Due date of the first charge
 */
public record CreateSubscriptionRequest(
        @NotNull(message = "Account ID is required")
        Long accountId,

        @NotBlank(message = "Service name is required")
        @Size(max = 100, message = "Service name must be at most 100 characters")
        String serviceName,

        @Size(max = 50, message = "Service category must be at most 50 characters")
        String serviceCategory,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        BillingCycle billingCycle,

        @NotNull(message = "First billing date is required")
        LocalDate firstBillingDate
) {
}
