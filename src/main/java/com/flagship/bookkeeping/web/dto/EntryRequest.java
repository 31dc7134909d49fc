package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LineItem;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Create or full-replace request for a journal entry. The date stays a string so the
 * ledger reports a malformed one with its own message.
 */
@Value
public class EntryRequest {

    @JsonProperty("accounting_date")
    String accountingDate;

    @NotNull(message = "entry_type is required")
    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("entry_title")
    String entryTitle;

    @JsonProperty("entry_text")
    String entryText;

    @JsonProperty("lines")
    List<LineRequest> lines;

    public List<LineItem> getLineItems() {
        if (lines == null) {
            return List.of();
        }
        return lines.stream().map(LineRequest::toLineItem).collect(Collectors.toList());
    }
}
