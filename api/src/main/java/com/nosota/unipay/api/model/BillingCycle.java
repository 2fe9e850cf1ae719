package com.nosota.unipay.api.model;

import java.time.LocalDate;

/**
 * Billing cycle of a subscription.
 */
public enum BillingCycle {
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY;

    /**
     * Computes the due date following {@code from}.
     * Month-based cycles clamp to the last day of shorter months (Jan 31 + 1 month = Feb 28/29).
     *
     * @param from the current billing date
     * @return the next billing date
     */
    public LocalDate next(LocalDate from) {
        return switch (this) {
            case WEEKLY -> from.plusWeeks(1);
            case MONTHLY -> from.plusMonths(1);
            case QUARTERLY -> from.plusMonths(3);
            case YEARLY -> from.plusYears(1);
        };
    }
}
