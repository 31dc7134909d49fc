package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Current balance of one active ASSET or LIAB account (debits positive).
 */
@Value
public class BalanceSheetRow {
    AccountType accountType;
    String accountCode;
    String accountName;
    BigDecimal balance;
    String iconKey;
}
