package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.expense.ExpenseForm;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Manual expense form: category rows paid from one payment account.
 */
@Value
public class ExpenseRequest {

    @NotNull(message = "accounting_date is required")
    @JsonProperty("accounting_date")
    LocalDate accountingDate;

    @JsonProperty("store")
    String store;

    @JsonProperty("note")
    String note;

    @JsonProperty("payment_account_code")
    String paymentAccountCode;

    @JsonProperty("currency")
    String currency;

    @NotEmpty(message = "At least one row is required")
    @Valid
    @JsonProperty("rows")
    List<Row> rows;

    @Value
    public static class Row {
        @NotNull(message = "category_code is required")
        @JsonProperty("category_code")
        String categoryCode;

        @JsonProperty("amount_domestic")
        BigDecimal amountDomestic;

        @JsonProperty("amount_original")
        BigDecimal amountOriginal;
    }

    public ExpenseForm toForm() {
        ExpenseForm.ExpenseFormBuilder builder = ExpenseForm.builder()
            .accountingDate(accountingDate)
            .store(store)
            .note(note)
            .paymentAccountCode(paymentAccountCode)
            .currency(currency);
        for (Row row : rows) {
            builder.row(new ExpenseForm.Row(row.getCategoryCode(), row.getAmountDomestic(), row.getAmountOriginal()));
        }
        return builder.build();
    }
}
