package com.flagship.bookkeeping.ledger;

/**
 * Kind of journal entry.
 */
public enum EntryType {
    /**
     * Simple entry: expense category debits closed by one implicit payment-account credit.
     */
    EXPENSE("Expense"),

    /**
     * Free-form multi-account entry.
     */
    GENERAL("Journal");

    private final String displayLabel;

    EntryType(String displayLabel) {
        this.displayLabel = displayLabel;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    public static EntryType fromDbValue(String value) {
        try {
            return EntryType.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown entry_type: " + value);
        }
    }
}
