package com.flagship.bookkeeping.importer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Outcome of a successful import: the new EXPENSE entry and its totals.
 * {@code lineCount} counts the category lines, not the synthesized payment credit.
 */
@Value
public class ExpenseImportResult {
    UUID entryUuid;
    LocalDate accountingDate;
    String currencyOriginal;
    BigDecimal totalAmountDomestic;
    int lineCount;
}
