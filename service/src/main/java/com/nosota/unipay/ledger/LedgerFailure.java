package com.nosota.unipay.ledger;

import com.nosota.unipay.api.model.AccountStatus;
import com.nosota.unipay.api.model.LedgerErrorCode;

import java.math.BigDecimal;

/**
 * Typed rejection of a ledger operation.
 * <p>
 * Amount fields are set whenever the rejection concerns an amount: {@code requested} is what the
 * operation asked for, {@code available} what the account could give, {@code shortfall} the difference.
 * </p>
 */
public record LedgerFailure(
        LedgerErrorCode code,
        String message,
        Long accountId,
        BigDecimal requested,
        BigDecimal available,
        BigDecimal shortfall
) {

    public static LedgerFailure of(LedgerErrorCode code, String message) {
        return new LedgerFailure(code, message, null, null, null, null);
    }

    public static LedgerFailure insufficientFunds(Long accountId, BigDecimal requested, BigDecimal available) {
        BigDecimal shortfall = requested.subtract(available);
        return new LedgerFailure(LedgerErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient funds on account %d: requested %s, available %s, short by %s",
                        accountId, requested.toPlainString(), available.toPlainString(), shortfall.toPlainString()),
                accountId, requested, available, shortfall);
    }

    public static LedgerFailure limitExceeded(Long accountId, String message, BigDecimal requested, BigDecimal available) {
        return new LedgerFailure(LedgerErrorCode.LIMIT_EXCEEDED, message,
                accountId, requested, available, requested.subtract(available));
    }

    public static LedgerFailure accountNotFound(Long accountId) {
        return new LedgerFailure(LedgerErrorCode.ACCOUNT_NOT_FOUND,
                "Account not found: " + accountId, accountId, null, null, null);
    }

    public static LedgerFailure accountFrozen(Long accountId, AccountStatus status) {
        return new LedgerFailure(LedgerErrorCode.ACCOUNT_FROZEN,
                String.format("Account %d is %s", accountId, status), accountId, null, null, null);
    }

    public static LedgerFailure unauthorized(String message) {
        return of(LedgerErrorCode.UNAUTHORIZED, message);
    }

    public static LedgerFailure invalidState(String message) {
        return of(LedgerErrorCode.INVALID_STATE_TRANSITION, message);
    }

    public static LedgerFailure invalidRequest(String message) {
        return of(LedgerErrorCode.INVALID_REQUEST, message);
    }

    public static LedgerFailure lockTimeout(String operationId) {
        return of(LedgerErrorCode.LOCK_TIMEOUT,
                "Could not lock accounts of operation " + operationId + " in time, retry later");
    }
}
