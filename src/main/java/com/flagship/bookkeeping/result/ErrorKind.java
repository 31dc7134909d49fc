package com.flagship.bookkeeping.result;

/**
 * Classifies why a ledger operation was refused.
 */
public enum ErrorKind {
    /**
     * Input is malformed or breaks a rule the caller can fix (bad date, unbalanced lines,
     * unknown field, out-of-range value).
     */
    VALIDATION,

    /**
     * A referenced account is unknown or inactive.
     */
    REFERENTIAL,

    /**
     * The entry or account the operation targets does not exist.
     */
    NOT_FOUND,

    /**
     * An internally derived value broke an invariant (e.g. synthesized lines that do not balance).
     */
    INTERNAL_CONSISTENCY,

    /**
     * The database rejected or failed the write. The transaction was rolled back.
     */
    STORAGE
}
