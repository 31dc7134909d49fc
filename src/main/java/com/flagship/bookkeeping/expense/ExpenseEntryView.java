package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.EntryHeader;
import com.flagship.bookkeeping.ledger.EntryLine;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A stored EXPENSE entry decomposed back into the shape of an {@link ExpenseForm}:
 * payment account (first credited ASSET/LIAB line), currency (of the first line) and
 * the debited expense categories.
 */
@Value
public class ExpenseEntryView {
    EntryHeader header;
    String paymentAccountCode;
    String paymentAccountName;
    String currency;
    List<Category> categories;

    @Value
    public static class Category {
        String accountCode;
        String accountName;
        BigDecimal amountDomestic;
        BigDecimal amountOriginal;
    }

    /**
     * @return empty if the entry is not an EXPENSE entry
     */
    public static Optional<ExpenseEntryView> of(LedgerEntry entry) {
        if (entry.getHeader().getEntryType() != EntryType.EXPENSE) {
            return Optional.empty();
        }
        List<EntryLine> lines = entry.getLines();
        Optional<EntryLine> payment = lines.stream()
            .filter(l -> l.getDc() == DebitCredit.C)
            .filter(l -> AccountType.PAYMENT_TYPES.contains(l.getAccountType()))
            .findFirst();
        String currency = lines.isEmpty() ? null : lines.get(0).getCurrencyOriginal();
        List<Category> categories = lines.stream()
            .filter(l -> l.getDc() == DebitCredit.D && l.getAccountType() == AccountType.EXPENSE)
            .map(l -> new Category(l.getAccountCode(), l.getAccountName(), l.getAmountDomestic(), l.getAmountOriginal()))
            .collect(Collectors.toList());
        return Optional.of(new ExpenseEntryView(
            entry.getHeader(),
            payment.map(EntryLine::getAccountCode).orElse(null),
            payment.map(EntryLine::getAccountName).orElse(null),
            currency,
            categories
        ));
    }
}
