package com.flagship.bookkeeping.web.exception;

import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;

/**
 * Carries a refused ledger operation from a controller to {@link GlobalExceptionHandler}.
 * Only the HTTP layer throws it; services return {@link LedgerResult}.
 */
public class LedgerOperationException extends RuntimeException {

    private final transient LedgerError error;

    public LedgerOperationException(LedgerError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }

    public static <T> T valueOrThrow(LedgerResult<T> result) {
        if (result.isFailure()) {
            throw new LedgerOperationException(result.getError());
        }
        return result.getValue();
    }
}
