package com.flagship.bookkeeping.expense;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.EntryHeader;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LineItem;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.setting.SettingsService;
import com.flagship.bookkeeping.storage.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds EXPENSE entries: category debits closed by one credit to the payment account.
 *
 * Used by the manual expense form and by the JSON import pipeline, which share
 * {@link #buildBalancedItems}.
 */
@Service
@Slf4j
public class ExpenseEntryComposer {

    private final ChartOfAccountsService chartOfAccounts;
    private final LedgerService ledgerService;
    private final SettingsService settingsService;

    public ExpenseEntryComposer(ChartOfAccountsService chartOfAccounts,
                                LedgerService ledgerService,
                                SettingsService settingsService) {
        this.chartOfAccounts = chartOfAccounts;
        this.ledgerService = ledgerService;
        this.settingsService = settingsService;
    }

    /**
     * Turns category lines into balanced ledger items.
     *
     * Every line becomes a debit; the payment account is credited with the domestic and
     * original totals. Fails if the domestic total is zero, or (INTERNAL_CONSISTENCY) if the
     * result does not balance.
     */
    public LedgerResult<BalancedItems> buildBalancedItems(String paymentAccountCode,
                                                          String currency,
                                                          List<ExpenseLine> lines) {
        List<LineItem> items = new ArrayList<>(lines.size() + 1);
        BigDecimal totalDomestic = BigDecimal.ZERO;
        BigDecimal totalOriginal = BigDecimal.ZERO;
        for (ExpenseLine line : lines) {
            items.add(LineItem.builder()
                .accountCode(line.getCategoryCode())
                .dc(DebitCredit.D)
                .amountDomestic(line.getAmountDomestic())
                .currencyOriginal(currency)
                .amountOriginal(line.getAmountOriginal())
                .itemText(line.getItemText())
                .build());
            totalDomestic = totalDomestic.add(line.getAmountDomestic());
            totalOriginal = totalOriginal.add(line.getAmountOriginal());
        }

        if (Amounts.isEffectivelyZero(totalDomestic)) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "amount_domestic", "Total amount_domestic must not be zero.");
        }

        items.add(LineItem.builder()
            .accountCode(paymentAccountCode)
            .dc(DebitCredit.C)
            .amountDomestic(totalDomestic)
            .currencyOriginal(currency)
            .amountOriginal(totalOriginal)
            .build());

        BigDecimal diff = items.stream().map(LineItem::signedAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (!Amounts.isBalanced(diff)) {
            return LedgerResult.failure(LedgerError.of(ErrorKind.INTERNAL_CONSISTENCY, "lines",
                String.format("Debit/Credit not balanced after build. diff=%.6f", diff)));
        }
        return LedgerResult.success(new BalancedItems(List.copyOf(items), totalDomestic, totalOriginal));
    }

    /**
     * Saves a manually entered expense.
     *
     * Zero-amount rows are skipped. In a foreign currency every row needs a non-zero
     * original amount; in the domestic currency the original amount is the domestic one.
     *
     * @param entryUuid id of the entry to replace, or null to create a new one
     */
    public LedgerResult<UUID> saveExpense(ExpenseForm form, UUID entryUuid) {
        if (entryUuid != null) {
            Optional<EntryHeader> existing = ledgerService.getEntryHeader(entryUuid);
            if (existing.isEmpty()) {
                return LedgerResult.failure(LedgerError.notFound("entry_uuid", "Entry not found: " + entryUuid));
            }
            if (existing.get().getEntryType() != EntryType.EXPENSE) {
                return LedgerResult.failure(LedgerError.validation("entry_type",
                    "Entry is not an EXPENSE entry: " + entryUuid).with("entry_type", existing.get().getEntryType().name()));
            }
        }
        String domestic = settingsService.getDomesticCurrency();
        String currency = form.getCurrency() == null || form.getCurrency().isBlank()
            ? domestic
            : form.getCurrency().trim().toUpperCase(Locale.ROOT);
        boolean foreign = !currency.equals(domestic);

        List<ExpenseLine> lines = new ArrayList<>();
        for (ExpenseForm.Row row : form.getRows()) {
            Optional<Account> category = chartOfAccounts.findByCode(row.getCategoryCode())
                .filter(a -> a.getType() == AccountType.EXPENSE && a.isActive());
            if (category.isEmpty()) {
                return LedgerResult.failure(LedgerError.validation("expense_category",
                    "Invalid expense category selection: " + row.getCategoryCode()));
            }
            BigDecimal amountDomestic = row.getAmountDomestic();
            if (amountDomestic == null || Amounts.isEffectivelyZero(amountDomestic)) {
                continue;
            }
            BigDecimal amountOriginal;
            if (foreign) {
                amountOriginal = row.getAmountOriginal();
                if (amountOriginal == null || Amounts.isEffectivelyZero(amountOriginal)) {
                    return LedgerResult.failure(LedgerError.validation("amount_original",
                        "Original amount is required when currency is foreign and cannot be zero")
                        .with("account_code", row.getCategoryCode()));
                }
            } else {
                amountOriginal = amountDomestic;
            }
            lines.add(new ExpenseLine(category.get().getCode(), amountDomestic, amountOriginal, null));
        }
        if (lines.isEmpty()) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "lines", "Add at least one expense line with non-zero amount");
        }
        if (form.getPaymentAccountCode() == null || form.getPaymentAccountCode().isBlank()) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "payment_account", "Payment account is required");
        }
        Optional<Account> paymentAccount = chartOfAccounts.findByCode(form.getPaymentAccountCode().trim())
            .filter(a -> AccountType.PAYMENT_TYPES.contains(a.getType()) && a.isActive());
        if (paymentAccount.isEmpty()) {
            return LedgerResult.failure(LedgerError.validation("payment_account",
                "Invalid payment account selection: " + form.getPaymentAccountCode())
                .with("account_code", form.getPaymentAccountCode()));
        }
        if (form.getAccountingDate() == null) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "accounting_date", "accounting_date must be ISO date YYYY-MM-DD");
        }

        LedgerResult<BalancedItems> built = buildBalancedItems(paymentAccount.get().getCode(), currency, lines);
        if (built.isFailure()) {
            return built.castFailure();
        }
        boolean isNew = entryUuid == null;
        return ledgerService.saveEntryFullReplace(
            isNew ? UUID.randomUUID() : entryUuid,
            form.getAccountingDate().toString(),
            EntryType.EXPENSE,
            trimToNull(form.getStore()),
            trimToNull(form.getNote()),
            built.getValue().getItems(),
            isNew
        );
    }

    /**
     * Loads a stored EXPENSE entry in form shape.
     */
    public LedgerResult<ExpenseEntryView> loadExpense(UUID entryUuid) {
        Optional<LedgerEntry> entry = ledgerService.getEntry(entryUuid);
        if (entry.isEmpty()) {
            return LedgerResult.failure(LedgerError.notFound("entry_uuid", "Entry not found: " + entryUuid));
        }
        Optional<ExpenseEntryView> view = ExpenseEntryView.of(entry.get());
        if (view.isEmpty()) {
            return LedgerResult.failure(LedgerError.validation("entry_type",
                "Entry is not an EXPENSE entry: " + entryUuid));
        }
        return LedgerResult.success(view.get());
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
