package com.nosota.unipay.ledger;

import com.nosota.unipay.api.model.LedgerErrorCode;
import com.nosota.unipay.error.LedgerOperationException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a ledger operation: a value, a value of an operation that had already been
 * applied (DUPLICATE_OPERATION, success-equivalent) or a typed {@link LedgerFailure}.
 *
 * <p>Expected business rejections travel as values of this type. Only conditions the caller
 * cannot act upon (store unreachable) are thrown.
 *
 * @param <T> payload type
 */
public final class LedgerResult<T> {

    private final T value;
    private final boolean duplicate;
    private final LedgerFailure failure;

    private LedgerResult(T value, boolean duplicate, LedgerFailure failure) {
        this.value = value;
        this.duplicate = duplicate;
        this.failure = failure;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(value, false, null);
    }

    public static <T> LedgerResult<T> duplicate(T value) {
        return new LedgerResult<>(value, true, null);
    }

    public static <T> LedgerResult<T> failure(LedgerFailure failure) {
        return new LedgerResult<>(null, false, Objects.requireNonNull(failure));
    }

    /**
     * @return true for fresh applications and duplicates
     */
    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public boolean hasCode(LedgerErrorCode code) {
        return failure != null && failure.code() == code;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value in failed result: " + failure.code());
        }
        return value;
    }

    public LedgerFailure getFailure() {
        return failure;
    }

    /**
     * Transforms the payload, keeping the duplicate flag and passing failures through unchanged.
     */
    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (failure != null) {
            return failure(failure);
        }
        return new LedgerResult<>(mapper.apply(value), duplicate, null);
    }

    /**
     * @return the payload
     * @throws LedgerOperationException carrying the failure if the operation was rejected
     */
    public T orElseThrow() {
        if (failure != null) {
            throw new LedgerOperationException(failure);
        }
        return value;
    }

    @Override
    public String toString() {
        if (failure != null) {
            return "LedgerResult[failure=" + failure.code() + "]";
        }
        return "LedgerResult[value=" + value + ", duplicate=" + duplicate + "]";
    }
}
