package com.nosota.unipay.api.response;

import com.nosota.unipay.api.model.AccountKind;
import com.nosota.unipay.api.model.AccountStatus;

import java.math.BigDecimal;

/**
 * Response for account balance query.
 */
public record BalanceResponse(
        Long accountId,
        AccountKind kind,
        AccountStatus status,
        BigDecimal balance,
        String currency
) {}
