package com.flagship.bookkeeping.account;

import com.flagship.bookkeeping.observability.LedgerMetrics;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.storage.LedgerWriteSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chart-of-accounts store.
 *
 * Owns account definitions, allocates codes for user-managed ASSET/LIAB accounts and is the
 * only name-to-code resolution path used by the import pipeline.
 *
 * Accounts are never deleted: historical entry lines keep referencing their code, so
 * deactivation is the only way to retire one.
 */
@Service
@Slf4j
public class ChartOfAccountsService {

    private static final String SELECT_ACCOUNT =
        "SELECT account_code, account_name, account_type, is_pl, is_active, is_user_managed FROM gl_account";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerWriteSerializer writeSerializer;
    private final LedgerMetrics metrics;

    public ChartOfAccountsService(JdbcTemplate jdbcTemplate,
                                  LedgerWriteSerializer writeSerializer,
                                  LedgerMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.writeSerializer = writeSerializer;
        this.metrics = metrics;
    }

    /**
     * Lists accounts matching the filter, ordered by code.
     */
    public List<Account> listAccounts(AccountFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_ACCOUNT).append(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (filter.getActive() != null) {
            sql.append(" AND is_active = ?");
            params.add(filter.getActive() ? 1 : 0);
        }
        appendTypeFilter(sql, params, filter.getTypes());
        sql.append(" ORDER BY account_code");
        return jdbcTemplate.query(sql.toString(), accountRowMapper(), params.toArray());
    }

    public List<Account> listExpenseCategories() {
        return listAccounts(AccountFilter.activeOfTypes(AccountType.EXPENSE));
    }

    public List<Account> listAssetAccounts() {
        return listAccounts(AccountFilter.activeOfTypes(AccountType.ASSET));
    }

    /**
     * Payment accounts can be ASSET (cash/bank) or LIAB (credit card).
     */
    public List<Account> listPaymentAccounts() {
        return listAccounts(AccountFilter.activeOfTypes(AccountType.ASSET, AccountType.LIAB));
    }

    /**
     * All active accounts, for free-form General entries.
     */
    public List<Account> listAllActiveAccounts() {
        return listAccounts(AccountFilter.allActive());
    }

    /**
     * User-managed balance-sheet accounts: active ASSET first, then active LIAB, then
     * inactive ones, each group by name.
     */
    public List<Account> listUserManagedBalanceSheetAccounts() {
        return jdbcTemplate.query(
            SELECT_ACCOUNT +
            " WHERE is_user_managed = 1 AND account_type IN ('ASSET','LIAB')" +
            " ORDER BY CASE WHEN is_active = 0 THEN 3 WHEN account_type = 'ASSET' THEN 1 ELSE 2 END," +
            " account_name",
            accountRowMapper()
        );
    }

    public Optional<Account> findByCode(String accountCode) {
        if (accountCode == null) {
            return Optional.empty();
        }
        List<Account> rows = jdbcTemplate.query(
            SELECT_ACCOUNT + " WHERE account_code = ?", accountRowMapper(), accountCode);
        return rows.stream().findFirst();
    }

    public Optional<Account> getUserManagedAccount(String accountCode) {
        return findByCode(accountCode)
            .filter(Account::isUserManaged)
            .filter(a -> a.getType().isUserManageable());
    }

    /**
     * Resolves an account by name, case-insensitively, among the allowed types.
     *
     * Returns empty when nothing matches, when more than one account matches (the name is
     * ambiguous) or, if {@code activeRequired}, when the match is inactive.
     *
     * @param allowedTypes restricts the match; empty means any type
     */
    public Optional<Account> findAccountByName(String accountName,
                                               Set<AccountType> allowedTypes,
                                               boolean activeRequired) {
        if (accountName == null || accountName.isBlank()) {
            return Optional.empty();
        }
        StringBuilder sql = new StringBuilder(SELECT_ACCOUNT).append(" WHERE account_name = ? COLLATE NOCASE");
        List<Object> params = new ArrayList<>();
        params.add(accountName);
        appendTypeFilter(sql, params, allowedTypes);

        List<Account> matches = jdbcTemplate.query(sql.toString(), accountRowMapper(), params.toArray());
        if (matches.size() > 1) {
            log.warn("Account name '{}' is ambiguous: {} matches among {}", accountName, matches.size(), allowedTypes);
            return Optional.empty();
        }
        return matches.stream()
            .findFirst()
            .filter(a -> !activeRequired || a.isActive());
    }

    public Optional<Account> findAccountByName(String accountName, Set<AccountType> allowedTypes) {
        return findAccountByName(accountName, allowedTypes, true);
    }

    /**
     * Finds an active ASSET or LIAB account by name.
     */
    public Optional<Account> findPaymentAccountByName(String accountName) {
        return findAccountByName(accountName, AccountType.PAYMENT_TYPES, true);
    }

    /**
     * Computes the next unused code in the range reserved for {@code type}:
     * {@code max(codes matching the range prefix, range floor) + 1}, zero-padded to 10 digits.
     *
     * The scan is by code prefix, not stored type, so a row whose type disagrees with its
     * prefix still reserves its code.
     */
    public LedgerResult<String> nextUserManagedCode(AccountType type) {
        Optional<CodeRange> range = type == null ? Optional.empty() : type.userManagedCodeRange();
        if (range.isEmpty()) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "account_type",
                "account_type must be ASSET or LIAB: " + type);
        }
        CodeRange codeRange = range.get();
        Long max = jdbcTemplate.queryForObject(
            "SELECT MAX(CAST(account_code AS INTEGER)) FROM gl_account WHERE account_code GLOB ?",
            Long.class,
            codeRange.getGlobPattern()
        );
        long next = (max != null ? max : codeRange.getFloor()) + 1;
        if (next > codeRange.getCeiling()) {
            return LedgerResult.failure(LedgerError.validation("account_type",
                "No free account code left in the " + type + " range").with("last_code", CodeRange.format(max)));
        }
        return LedgerResult.success(CodeRange.format(next));
    }

    /**
     * Creates a user-managed ASSET or LIAB account under a freshly allocated code.
     */
    public LedgerResult<Account> createUserManagedAccount(String accountName, AccountType type, boolean active) {
        if (type == null || !type.isUserManageable()) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "account_type",
                "account_type must be ASSET or LIAB: " + type);
        }
        LedgerResult<String> name = normalizeName(accountName);
        if (name.isFailure()) {
            return name.castFailure();
        }

        LedgerResult<Account> result = writeSerializer.write("create-account", () -> {
            LedgerResult<Void> unique = requireUniqueName(name.getValue(), null);
            if (unique.isFailure()) {
                return unique.castFailure();
            }
            LedgerResult<String> code = nextUserManagedCode(type);
            if (code.isFailure()) {
                return code.castFailure();
            }
            jdbcTemplate.update(
                "INSERT INTO gl_account (account_code, account_name, account_type, is_pl, is_active, is_user_managed) " +
                "VALUES (?, ?, ?, 0, ?, 1)",
                code.getValue(), name.getValue(), type.name(), active ? 1 : 0
            );
            return LedgerResult.success(new Account(code.getValue(), name.getValue(), type, false, active, true));
        });

        result.onFailure(error -> log.warn("Account creation rejected: name={}, type={}, reason={}",
            accountName, type, error.getMessage()));
        if (result.isSuccess()) {
            metrics.incrementAccountsCreated();
            log.info("Created user-managed account: code={}, name={}, type={}",
                result.getValue().getCode(), result.getValue().getName(), type);
        }
        return result;
    }

    /**
     * Renames and/or (de)activates a user-managed ASSET or LIAB account.
     * System accounts are never touched by this path: they are reported as not found.
     */
    public LedgerResult<Account> updateUserManagedAccount(String accountCode, String accountName, boolean active) {
        LedgerResult<String> name = normalizeName(accountName);
        if (name.isFailure()) {
            return name.castFailure();
        }

        LedgerResult<Account> result = writeSerializer.write("update-account", () -> {
            LedgerResult<Void> unique = requireUniqueName(name.getValue(), accountCode);
            if (unique.isFailure()) {
                return unique.castFailure();
            }
            int updated = jdbcTemplate.update(
                "UPDATE gl_account SET account_name = ?, is_active = ? " +
                "WHERE account_code = ? AND is_user_managed = 1 AND account_type IN ('ASSET','LIAB')",
                name.getValue(), active ? 1 : 0, accountCode
            );
            if (updated == 0) {
                return LedgerResult.failure(LedgerError.notFound("account_code",
                    "Account not found or not user managed: " + accountCode).with("account_code", accountCode));
            }
            return findByCode(accountCode)
                .map(LedgerResult::success)
                .orElseGet(() -> LedgerResult.failure(LedgerError.notFound("account_code",
                    "Account not found: " + accountCode)));
        });

        result.onFailure(error -> log.warn("Account update rejected: code={}, reason={}", accountCode, error.getMessage()));
        if (result.isSuccess()) {
            log.info("Updated user-managed account: code={}, name={}, active={}", accountCode, name.getValue(), active);
        }
        return result;
    }

    private LedgerResult<String> normalizeName(String accountName) {
        String trimmed = accountName == null ? "" : accountName.trim();
        if (trimmed.isEmpty()) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "account_name", "Account name is required");
        }
        return LedgerResult.success(trimmed);
    }

    /**
     * Names must stay unique case-insensitively, otherwise name resolution would become ambiguous.
     */
    private LedgerResult<Void> requireUniqueName(String name, String exceptCode) {
        Integer clashes = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM gl_account WHERE account_name = ? COLLATE NOCASE AND account_code <> ?",
            Integer.class,
            name,
            exceptCode == null ? "" : exceptCode
        );
        if (clashes != null && clashes > 0) {
            return LedgerResult.failure(LedgerError.validation("account_name",
                "Account name already exists: " + name).with("account_name", name));
        }
        return LedgerResult.success(null);
    }

    private static void appendTypeFilter(StringBuilder sql, List<Object> params, Collection<AccountType> types) {
        if (types == null || types.isEmpty()) {
            return;
        }
        List<AccountType> ordered = new ArrayList<>(types);
        Collections.sort(ordered);
        sql.append(" AND account_type IN (")
            .append(ordered.stream().map(t -> "?").collect(Collectors.joining(",")))
            .append(")");
        ordered.forEach(t -> params.add(t.name()));
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("account_code"),
            rs.getString("account_name"),
            AccountType.fromDbValue(rs.getString("account_type")),
            rs.getInt("is_pl") == 1,
            rs.getInt("is_active") == 1,
            rs.getInt("is_user_managed") == 1
        );
    }
}
