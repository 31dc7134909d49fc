package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.ledger.LineItem;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Category debits followed by the single payment-account credit that closes them.
 */
@Value
public class BalancedItems {
    List<LineItem> items;
    BigDecimal totalDomestic;
    BigDecimal totalOriginal;

    public int getExpenseLineCount() {
        return items.size() - 1;
    }
}
