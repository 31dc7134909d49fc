package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A persisted entry line joined with its account's name and type for display.
 * {@code lineNo} is dense and 1-based but is renumbered by every full replace.
 */
@Value
public class EntryLine {
    UUID entryUuid;
    int lineNo;
    String accountCode;
    String accountName;
    AccountType accountType;
    DebitCredit dc;
    BigDecimal amountDomestic;
    String currencyOriginal;
    BigDecimal amountOriginal;
    String itemText;

    /**
     * Converts back to the write form, so a stored entry can be resubmitted unchanged.
     */
    public LineItem toLineItem() {
        return LineItem.builder()
            .accountCode(accountCode)
            .dc(dc)
            .amountDomestic(amountDomestic)
            .currencyOriginal(currencyOriginal)
            .amountOriginal(amountOriginal)
            .itemText(itemText)
            .build();
    }
}
