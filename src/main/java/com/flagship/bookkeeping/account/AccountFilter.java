package com.flagship.bookkeeping.account;

import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Predicate used by {@link ChartOfAccountsService#listAccounts(AccountFilter)}.
 * A null {@code active} means "any"; an empty type set means "any type".
 */
@Value
public class AccountFilter {
    Boolean active;
    Set<AccountType> types;

    public static AccountFilter all() {
        return new AccountFilter(null, Collections.emptySet());
    }

    public static AccountFilter activeOfTypes(AccountType first, AccountType... rest) {
        return new AccountFilter(Boolean.TRUE, Collections.unmodifiableSet(EnumSet.of(first, rest)));
    }

    public static AccountFilter allActive() {
        return new AccountFilter(Boolean.TRUE, Collections.emptySet());
    }
}
