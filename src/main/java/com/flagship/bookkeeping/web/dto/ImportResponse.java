package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.importer.ExpenseImportResult;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class ImportResponse {

    @JsonProperty("entry_uuid")
    UUID entryUuid;

    @JsonProperty("accounting_date")
    LocalDate accountingDate;

    @JsonProperty("currency_original")
    String currencyOriginal;

    @JsonProperty("total_amount_domestic")
    BigDecimal totalAmountDomestic;

    @JsonProperty("line_count")
    int lineCount;

    public static ImportResponse from(ExpenseImportResult result) {
        return new ImportResponse(result.getEntryUuid(), result.getAccountingDate(), result.getCurrencyOriginal(),
            result.getTotalAmountDomestic(), result.getLineCount());
    }
}
