package com.flagship.bookkeeping.expense;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Manually entered expense: category rows paid from one payment account.
 * A blank currency means the domestic currency.
 */
@Value
@Builder
public class ExpenseForm {
    LocalDate accountingDate;
    String store;
    String note;
    String paymentAccountCode;
    String currency;
    @Singular
    List<Row> rows;

    @Value
    public static class Row {
        String categoryCode;
        BigDecimal amountDomestic;
        BigDecimal amountOriginal;
    }
}
