package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.report.JournalRow;
import com.flagship.bookkeeping.report.MoneyFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class JournalRowResponse {

    @JsonProperty("accounting_date")
    LocalDate accountingDate;

    @JsonProperty("entry_uuid")
    UUID entryUuid;

    @JsonProperty("title")
    String title;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("amount_domestic")
    BigDecimal amountDomestic;

    @JsonProperty("amount_text")
    String amountText;

    @JsonProperty("icon_key")
    String iconKey;

    public static JournalRowResponse from(JournalRow row, String currency) {
        return JournalRowResponse.builder()
            .accountingDate(row.getAccountingDate())
            .entryUuid(row.getEntryUuid())
            .title(row.getEntryTitle())
            .accountName(row.getAccountName())
            .amountDomestic(row.getAmountDomestic())
            .amountText(MoneyFormat.format(row.getAmountDomestic(), currency))
            .iconKey(row.getIconKey())
            .build();
    }
}
