package com.flagship.bookkeeping.result;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a validating ledger operation: either a value or a {@link LedgerError}.
 *
 * Validation failures travel back to the caller as values; nothing is thrown for a
 * rejected write.
 *
 * @param <T> type of the success value
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerError error;

    private LedgerResult(T value, LedgerError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> LedgerResult<T> success(T value) {
        return new LedgerResult<>(value, null);
    }

    public static <T> LedgerResult<T> failure(LedgerError error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> LedgerResult<T> failure(ErrorKind kind, String field, String message) {
        return failure(LedgerError.of(kind, field, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present, operation failed: " + error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this result is a success
     */
    public LedgerError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present, operation succeeded");
        }
        return error;
    }

    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    public <R> LedgerResult<R> flatMap(Function<? super T, LedgerResult<R>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    public LedgerResult<T> mapError(Function<LedgerError, LedgerError> mapper) {
        if (error == null) {
            return this;
        }
        return failure(mapper.apply(error));
    }

    public LedgerResult<T> onFailure(Consumer<LedgerError> action) {
        if (error != null) {
            action.accept(error);
        }
        return this;
    }

    /**
     * Re-types a failure so it can be returned from a method with a different value type.
     */
    public <R> LedgerResult<R> castFailure() {
        return failure(getError());
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
