package com.flagship.bookkeeping.web.exception;

import com.flagship.bookkeeping.result.LedgerError;

/**
 * A failed import. All import failures share one status, whatever stage produced them.
 */
public class ImportRejectedException extends RuntimeException {

    private final transient LedgerError error;

    public ImportRejectedException(LedgerError error) {
        super(error.getMessage());
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }
}
