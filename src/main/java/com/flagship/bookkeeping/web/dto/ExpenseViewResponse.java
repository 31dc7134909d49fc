package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.expense.ExpenseEntryView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class ExpenseViewResponse {

    @JsonProperty("entry_uuid")
    UUID entryUuid;

    @JsonProperty("accounting_date")
    LocalDate accountingDate;

    @JsonProperty("store")
    String store;

    @JsonProperty("note")
    String note;

    @JsonProperty("payment_account_code")
    String paymentAccountCode;

    @JsonProperty("payment_account_name")
    String paymentAccountName;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("rows")
    List<Row> rows;

    @Value
    public static class Row {
        @JsonProperty("category_code")
        String categoryCode;

        @JsonProperty("category_name")
        String categoryName;

        @JsonProperty("amount_domestic")
        BigDecimal amountDomestic;

        @JsonProperty("amount_original")
        BigDecimal amountOriginal;
    }

    public static ExpenseViewResponse from(ExpenseEntryView view) {
        return ExpenseViewResponse.builder()
            .entryUuid(view.getHeader().getEntryUuid())
            .accountingDate(view.getHeader().getAccountingDate())
            .store(view.getHeader().getEntryTitle())
            .note(view.getHeader().getEntryText())
            .paymentAccountCode(view.getPaymentAccountCode())
            .paymentAccountName(view.getPaymentAccountName())
            .currency(view.getCurrency())
            .rows(view.getCategories().stream()
                .map(c -> new Row(c.getAccountCode(), c.getAccountName(), c.getAmountDomestic(), c.getAmountOriginal()))
                .collect(Collectors.toList()))
            .build();
    }
}
