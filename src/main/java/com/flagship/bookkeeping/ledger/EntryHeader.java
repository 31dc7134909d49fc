package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Journal entry header as stored in {@code gl_entry}.
 *
 * {@code modificationDate} is the time of the latest create or replace, not an audit trail.
 */
@Value
public class EntryHeader {
    UUID entryUuid;
    LocalDateTime modificationDate;
    LocalDate accountingDate;
    EntryType entryType;
    String entryTitle;
    String entryText;
}
