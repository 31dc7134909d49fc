package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One line of a date-grouped journal list. Carries what a list row renders, not the line identity.
 */
@Value
public class JournalRow {
    LocalDate accountingDate;
    UUID entryUuid;
    String entryTitle;
    String accountName;
    AccountType accountType;
    BigDecimal amountDomestic;
    String iconKey;
}
