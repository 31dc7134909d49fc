package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.util.List;

/**
 * A complete entry: header plus its lines in line order.
 */
@Value
public class LedgerEntry {
    EntryHeader header;
    List<EntryLine> lines;
}
