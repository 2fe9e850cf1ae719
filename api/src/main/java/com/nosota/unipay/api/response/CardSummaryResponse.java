package com.nosota.unipay.api.response;

import com.nosota.unipay.api.model.AccountStatus;

import java.math.BigDecimal;

/**
 * Budget card overview.
 *
 * @param remainingThisMonth Monthly limit minus spent this month, null when no limit is set
 */
public record CardSummaryResponse(
        Long cardId,
        Long walletId,
        String name,
        AccountStatus status,
        BigDecimal balance,
        BigDecimal monthlyLimit,
        BigDecimal spentThisMonth,
        BigDecimal remainingThisMonth,
        String currency
) {}
