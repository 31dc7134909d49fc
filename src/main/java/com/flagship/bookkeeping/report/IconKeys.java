package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;

import java.util.Map;

/**
 * Presentation icon keys for list and chart rows. The presentation layer maps keys to glyphs.
 */
public final class IconKeys {

    private static final Map<String, String> EXPENSE_ICON_BY_CODE = Map.ofEntries(
        Map.entry("5000000000", "uncategorized"),
        Map.entry("5000000001", "dining"),
        Map.entry("5000000002", "clothing"),
        Map.entry("5000000003", "leisure"),
        Map.entry("5000000004", "transport"),
        Map.entry("5000000005", "housing"),
        Map.entry("5000000006", "utilities"),
        Map.entry("5000000007", "household"),
        Map.entry("5000000008", "healthcare"),
        Map.entry("5000000009", "taxes"),
        Map.entry("5000000010", "other")
    );

    private IconKeys() {
    }

    public static String forAccount(String accountCode, AccountType type) {
        switch (type) {
            case EXPENSE:
                return EXPENSE_ICON_BY_CODE.getOrDefault(accountCode, "expense");
            case ASSET:
                return Account.CASH_CODE.equals(accountCode) ? "cash" : "bank";
            case LIAB:
                return "card";
            case EQUITY:
            case INCOME:
                return "default";
            default:
                throw new IllegalStateException("Unhandled account type: " + type);
        }
    }
}
