package com.nosota.unipay.ledger;

import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.error.LockContentionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs a ledger operation again when it returned LOCK_TIMEOUT, a bounded number of times.
 *
 * <p>Must wrap a whole operation, never a step inside an open transaction: a retry only helps
 * once the failed attempt has rolled back and released its locks. After the last attempt the
 * LOCK_TIMEOUT result is returned to the caller as a transient failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferRetryExecutor {

    private final RetryTemplate lockRetryTemplate;

    public <T> LedgerResult<T> execute(String operationId, Supplier<LedgerResult<T>> operation) {
        AtomicReference<LedgerResult<T>> lastResult = new AtomicReference<>();

        RetryCallback<LedgerResult<T>, LockContentionException> attempt = context -> {
            LedgerResult<T> result = operation.get();
            lastResult.set(result);
            if (result.hasCode(LedgerErrorCode.LOCK_TIMEOUT)) {
                log.warn("Lock timeout: operationId={}, attempt={}", operationId, context.getRetryCount() + 1);
                throw new LockContentionException("Lock timeout on " + operationId);
            }
            return result;
        };
        RecoveryCallback<LedgerResult<T>> giveUp = context -> {
            log.warn("Giving up after lock timeouts: operationId={}, attempts={}",
                    operationId, context.getRetryCount());
            return lastResult.get();
        };

        return lockRetryTemplate.execute(attempt, giveUp);
    }
}
