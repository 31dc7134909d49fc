package com.flagship.bookkeeping.ledger;

import java.math.BigDecimal;

/**
 * Side of an entry line. Stored as the single letter {@code D} or {@code C}.
 * Every entry must have balanced debits and credits.
 */
public enum DebitCredit {
    D,
    C;

    /**
     * Signed contribution of an amount to the entry balance: debits positive, credits negative.
     */
    public BigDecimal signed(BigDecimal amount) {
        switch (this) {
            case D:
                return amount;
            case C:
                return amount.negate();
            default:
                throw new IllegalStateException("Unhandled side: " + this);
        }
    }

    /**
     * @throws IllegalArgumentException if the stored value is not D or C
     */
    public static DebitCredit fromDbValue(String value) {
        if ("D".equals(value)) {
            return D;
        }
        if ("C".equals(value)) {
            return C;
        }
        throw new IllegalArgumentException("dc must be D or C: " + value);
    }
}
