package com.flagship.bookkeeping.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One debit or credit line submitted to {@link LedgerService#saveEntryFullReplace}.
 * Line numbers are assigned at write time from the submission order.
 */
@Value
@Builder
public class LineItem {
    String accountCode;
    DebitCredit dc;
    BigDecimal amountDomestic;
    String currencyOriginal;
    BigDecimal amountOriginal;
    String itemText;

    public static LineItem debit(String accountCode, BigDecimal amountDomestic, String currency) {
        return new LineItem(accountCode, DebitCredit.D, amountDomestic, currency, amountDomestic, null);
    }

    public static LineItem credit(String accountCode, BigDecimal amountDomestic, String currency) {
        return new LineItem(accountCode, DebitCredit.C, amountDomestic, currency, amountDomestic, null);
    }

    /**
     * Signed contribution to the entry balance (debits positive).
     */
    public BigDecimal signedAmount() {
        return dc.signed(amountDomestic);
    }
}
