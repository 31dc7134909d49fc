package com.flagship.bookkeeping.account;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Account classes of the chart of accounts.
 *
 * The enum constant name is the value stored in {@code gl_account.account_type}.
 * Balance-sheet classes carry their balance forward; INCOME and EXPENSE reset each period.
 */
public enum AccountType {
    ASSET("Assets", false),
    LIAB("Liabilities", false),
    EQUITY("Equity", false),
    INCOME("Income", true),
    EXPENSE("Expenses", true);

    /**
     * Accounts a payment can be drawn from: cash/bank (ASSET) or a card (LIAB).
     */
    public static final Set<AccountType> PAYMENT_TYPES = EnumSet.of(ASSET, LIAB);

    private final String displayLabel;
    private final boolean profitAndLoss;

    AccountType(String displayLabel, boolean profitAndLoss) {
        this.displayLabel = displayLabel;
        this.profitAndLoss = profitAndLoss;
    }

    public String getDisplayLabel() {
        return displayLabel;
    }

    public boolean isProfitAndLoss() {
        return profitAndLoss;
    }

    /**
     * Only ASSET and LIAB accounts may be created by the user at runtime.
     */
    public boolean isUserManageable() {
        return this == ASSET || this == LIAB;
    }

    /**
     * Returns the code range reserved for user-managed accounts of this type.
     */
    public Optional<CodeRange> userManagedCodeRange() {
        switch (this) {
            case ASSET:
                return Optional.of(CodeRange.ASSET);
            case LIAB:
                return Optional.of(CodeRange.LIAB);
            case EQUITY:
            case INCOME:
            case EXPENSE:
                return Optional.empty();
            default:
                throw new IllegalStateException("Unhandled account type: " + this);
        }
    }

    /**
     * Parses a stored {@code account_type} value.
     *
     * @throws IllegalArgumentException if the value is not a known account type
     */
    public static AccountType fromDbValue(String value) {
        try {
            return AccountType.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown account_type: " + value);
        }
    }
}
