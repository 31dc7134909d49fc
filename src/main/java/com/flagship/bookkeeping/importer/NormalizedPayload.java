package com.flagship.bookkeeping.importer;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.LocalDate;

/**
 * Top-level fields after validation. {@code lines} is still raw JSON.
 */
@Value
class NormalizedPayload {
    LocalDate accountingDate;
    String entryTitle;
    String entryText;
    String paymentAccountCode;
    String paymentAccountName;
    String currencyOriginal;
    JsonNode lines;
}
