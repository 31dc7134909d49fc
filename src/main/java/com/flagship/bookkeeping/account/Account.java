package com.flagship.bookkeeping.account;

import lombok.Value;

/**
 * A node of the chart of accounts.
 *
 * The code is the immutable 10-digit primary key; its leading digit encodes the category
 * ({@code 0} Cash, {@code 1}/{@code 2} user asset/liability ranges, {@code 3} equity,
 * {@code 4} income, {@code 5} expense categories).
 */
@Value
public class Account {
    public static final String CASH_CODE = "0000000001";

    String code;
    String name;
    AccountType type;
    boolean profitAndLoss;
    boolean active;
    boolean userManaged;

    public boolean isCash() {
        return CASH_CODE.equals(code);
    }
}
