package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.EntryHeader;
import com.flagship.bookkeeping.ledger.EntryLine;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class EntryResponse {

    @JsonProperty("entry_uuid")
    UUID entryUuid;

    @JsonProperty("modification_date")
    LocalDateTime modificationDate;

    @JsonProperty("accounting_date")
    LocalDate accountingDate;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("entry_type_label")
    String entryTypeLabel;

    @JsonProperty("entry_title")
    String entryTitle;

    @JsonProperty("entry_text")
    String entryText;

    @JsonProperty("has_attachment")
    boolean hasAttachment;

    @JsonProperty("lines")
    List<Line> lines;

    @Value
    public static class Line {
        @JsonProperty("line_no")
        int lineNo;

        @JsonProperty("account_code")
        String accountCode;

        @JsonProperty("account_name")
        String accountName;

        @JsonProperty("account_type")
        AccountType accountType;

        @JsonProperty("dc")
        DebitCredit dc;

        @JsonProperty("amount_domestic")
        BigDecimal amountDomestic;

        @JsonProperty("currency_original")
        String currencyOriginal;

        @JsonProperty("amount_original")
        BigDecimal amountOriginal;

        @JsonProperty("item_text")
        String itemText;

        static Line from(EntryLine line) {
            return new Line(line.getLineNo(), line.getAccountCode(), line.getAccountName(), line.getAccountType(),
                line.getDc(), line.getAmountDomestic(), line.getCurrencyOriginal(), line.getAmountOriginal(),
                line.getItemText());
        }
    }

    public static EntryResponse from(LedgerEntry entry, boolean hasAttachment) {
        EntryHeader header = entry.getHeader();
        return EntryResponse.builder()
            .entryUuid(header.getEntryUuid())
            .modificationDate(header.getModificationDate())
            .accountingDate(header.getAccountingDate())
            .entryType(header.getEntryType())
            .entryTypeLabel(header.getEntryType().getDisplayLabel())
            .entryTitle(header.getEntryTitle())
            .entryText(header.getEntryText())
            .hasAttachment(hasAttachment)
            .lines(entry.getLines().stream().map(Line::from).collect(Collectors.toList()))
            .build();
    }
}
