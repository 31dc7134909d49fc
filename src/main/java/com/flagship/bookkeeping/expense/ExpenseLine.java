package com.flagship.bookkeeping.expense;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One category debit of an expense entry, already resolved to an account code.
 */
@Value
public class ExpenseLine {
    String categoryCode;
    BigDecimal amountDomestic;
    BigDecimal amountOriginal;
    String itemText;
}
