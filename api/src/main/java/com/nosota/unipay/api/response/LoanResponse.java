package com.nosota.unipay.api.response;

import com.nosota.unipay.api.model.AccountStatus;

import java.math.BigDecimal;

/**
 * State of a loan after disbursement or repayment.
 */
public record LoanResponse(
        Long loanAccountId,
        Long lenderAccountId,
        Long borrowerAccountId,
        BigDecimal outstanding,
        AccountStatus status,
        String operationId,
        boolean duplicate
) {}
