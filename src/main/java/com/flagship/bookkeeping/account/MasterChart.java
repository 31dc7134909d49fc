package com.flagship.bookkeeping.account;

import java.util.List;

/**
 * System accounts written at database initialization (upsert by code).
 *
 * These accounts are not user-managed: the rename/deactivate path for user accounts
 * never touches them. The seed liability sits in the 1xxxxxxxxx range, so ASSET
 * allocation starts above it.
 */
public final class MasterChart {

    public static final String UNCATEGORIZED_CODE = "5000000000";

    public static final List<Account> ACCOUNTS = List.of(
        system(Account.CASH_CODE, "Cash", AccountType.ASSET),
        system("1000000001", "Dummy Credit card", AccountType.LIAB),
        system("3000000000", "Capital", AccountType.EQUITY),
        system("4000000000", "Income", AccountType.INCOME),
        system(UNCATEGORIZED_CODE, "Uncategorized", AccountType.EXPENSE),
        system("5000000001", "Food and dining", AccountType.EXPENSE),
        system("5000000002", "Clothing and personal care", AccountType.EXPENSE),
        system("5000000003", "Entertainment and leisure", AccountType.EXPENSE),
        system("5000000004", "Transportation", AccountType.EXPENSE),
        system("5000000005", "Housing", AccountType.EXPENSE),
        system("5000000006", "Utilities and communications", AccountType.EXPENSE),
        system("5000000007", "Household supplies", AccountType.EXPENSE),
        system("5000000008", "Healthcare", AccountType.EXPENSE),
        system("5000000009", "Taxes and social security", AccountType.EXPENSE),
        system("5000000010", "Other expenses", AccountType.EXPENSE)
    );

    private MasterChart() {
    }

    private static Account system(String code, String name, AccountType type) {
        return new Account(code, name, type, type.isProfitAndLoss(), true, false);
    }
}
