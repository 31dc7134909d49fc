package com.flagship.bookkeeping.result;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured description of a refused operation.
 *
 * The message is meant to be shown to the user as-is; {@code field} and {@code context}
 * name the offending input and the identifiers involved.
 */
@Value
public class LedgerError {
    ErrorKind kind;
    String field;
    String message;
    Map<String, String> context;

    public static LedgerError of(ErrorKind kind, String message) {
        return new LedgerError(kind, null, message, Map.of());
    }

    public static LedgerError of(ErrorKind kind, String field, String message) {
        return new LedgerError(kind, field, message, Map.of());
    }

    public static LedgerError validation(String field, String message) {
        return of(ErrorKind.VALIDATION, field, message);
    }

    public static LedgerError notFound(String field, String message) {
        return of(ErrorKind.NOT_FOUND, field, message);
    }

    /**
     * Returns a copy carrying one more context entry.
     */
    public LedgerError with(String key, Object value) {
        Map<String, String> merged = new LinkedHashMap<>(context);
        merged.put(key, String.valueOf(value));
        return new LedgerError(kind, field, message, Collections.unmodifiableMap(merged));
    }

    /**
     * Returns a copy whose message is prefixed, keeping kind, field and context.
     */
    public LedgerError prefixed(String prefix) {
        return new LedgerError(kind, field, prefix + message, context);
    }

    @Override
    public String toString() {
        return kind + (field != null ? "[" + field + "]" : "") + ": " + message;
    }
}
