package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.storage.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Read-only projections over the ledger.
 *
 * Every query only considers active accounts. Amounts are signed with debits positive,
 * so liabilities normally show negative balances. Date bounds are inclusive.
 */
@Service
@Slf4j
public class ReportingService {

    private static final String SIGNED_AMOUNT =
        "CASE WHEN ei.dc = 'D' THEN ei.amount_domestic ELSE -ei.amount_domestic END";

    private final JdbcTemplate jdbcTemplate;

    public ReportingService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Lines of EXPENSE accounts, newest entry first.
     */
    public List<JournalRow> listExpenseList() {
        return listJournal(null, AccountType.EXPENSE);
    }

    /**
     * Lines posted to one account, newest entry first.
     */
    public List<JournalRow> listAccountTransactions(String accountCode) {
        return listJournal(accountCode, null);
    }

    /**
     * Journal lines filtered by account and/or account type, ordered by accounting date
     * descending, then entry id descending, then line number. The amount is the unsigned
     * domestic amount as posted.
     */
    public List<JournalRow> listJournal(String accountCode, AccountType accountType) {
        StringBuilder sql = new StringBuilder(
            "SELECT e.accounting_date, e.entry_uuid, e.entry_title, ei.account_code, a.account_name, " +
            "a.account_type, ei.amount_domestic " +
            "FROM gl_entry_item ei " +
            "JOIN gl_entry e ON e.entry_uuid = ei.entry_uuid " +
            "JOIN gl_account a ON a.account_code = ei.account_code " +
            "WHERE a.is_active = 1");
        List<Object> params = new ArrayList<>();
        if (accountCode != null) {
            sql.append(" AND ei.account_code = ?");
            params.add(accountCode);
        }
        if (accountType != null) {
            sql.append(" AND a.account_type = ?");
            params.add(accountType.name());
        }
        sql.append(" ORDER BY e.accounting_date DESC, e.entry_uuid DESC, ei.line_no ASC");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> {
            String code = rs.getString("account_code");
            AccountType type = AccountType.fromDbValue(rs.getString("account_type"));
            return new JournalRow(
                LocalDate.parse(rs.getString("accounting_date")),
                UUID.fromString(rs.getString("entry_uuid")),
                rs.getString("entry_title"),
                rs.getString("account_name"),
                type,
                Amounts.read(rs, "amount_domestic"),
                IconKeys.forAccount(code, type)
            );
        }, params.toArray());
    }

    /**
     * Current balance of every active ASSET and LIAB account over all lines ever posted.
     * Accounts without activity are listed with balance 0. ASSET first, then LIAB, each by code.
     */
    public List<BalanceSheetRow> getBalanceSheet() {
        return jdbcTemplate.query(
            "SELECT a.account_type, a.account_code, a.account_name, " +
            "COALESCE(SUM(" + SIGNED_AMOUNT + "), 0) AS balance_domestic " +
            "FROM gl_account a " +
            "LEFT JOIN gl_entry_item ei ON ei.account_code = a.account_code " +
            "WHERE a.is_active = 1 AND a.account_type IN ('ASSET','LIAB') " +
            "GROUP BY a.account_type, a.account_code, a.account_name " +
            "ORDER BY CASE a.account_type WHEN 'ASSET' THEN 1 WHEN 'LIAB' THEN 2 ELSE 9 END, a.account_code",
            (rs, rowNum) -> {
                String code = rs.getString("account_code");
                AccountType type = AccountType.fromDbValue(rs.getString("account_type"));
                return new BalanceSheetRow(
                    type,
                    code,
                    rs.getString("account_name"),
                    Amounts.readOrZero(rs, "balance_domestic"),
                    IconKeys.forAccount(code, type)
                );
            });
    }

    /**
     * Signed expense totals grouped by (label, category), ordered by label then code.
     *
     * @param from inclusive lower bound, or null
     * @param to   inclusive upper bound, or null
     */
    public List<ExpenseTrendPoint> listExpenseTrend(Granularity granularity, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT " + granularity.labelExpression() + " AS label, ei.account_code, a.account_name, " +
            "SUM(" + SIGNED_AMOUNT + ") AS amount_sum " +
            "FROM gl_entry_item ei " +
            "JOIN gl_entry e ON e.entry_uuid = ei.entry_uuid " +
            "JOIN gl_account a ON a.account_code = ei.account_code " +
            "WHERE a.is_active = 1 AND a.account_type = 'EXPENSE'");
        List<Object> params = new ArrayList<>();
        appendDateRange(sql, params, from, to);
        sql.append(" GROUP BY label, ei.account_code, a.account_name ORDER BY label ASC, ei.account_code ASC");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new ExpenseTrendPoint(
            rs.getString("label"),
            rs.getString("account_code"),
            rs.getString("account_name"),
            Amounts.readOrZero(rs, "amount_sum")
        ), params.toArray());
    }

    /**
     * Running ASSET and LIAB balances per bucket, starting from the opening balances before
     * {@code from}. Buckets without activity are not emitted.
     */
    public List<AssetsTrendPoint> listAssetsTrend(Granularity granularity, LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(
            "SELECT " + granularity.labelExpression() + " AS label, a.account_type, " +
            "SUM(" + SIGNED_AMOUNT + ") AS delta_amount " +
            "FROM gl_entry_item ei " +
            "JOIN gl_entry e ON e.entry_uuid = ei.entry_uuid " +
            "JOIN gl_account a ON a.account_code = ei.account_code " +
            "WHERE a.is_active = 1 AND a.account_type IN ('ASSET','LIAB')");
        List<Object> params = new ArrayList<>();
        appendDateRange(sql, params, from, to);
        sql.append(" GROUP BY label, a.account_type ORDER BY label ASC, a.account_type ASC");

        Map<String, BigDecimal[]> buckets = new TreeMap<>();
        jdbcTemplate.query(sql.toString(), rs -> {
            BigDecimal[] deltas = buckets.computeIfAbsent(rs.getString("label"),
                label -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            BigDecimal delta = Amounts.readOrZero(rs, "delta_amount");
            AccountType type = AccountType.fromDbValue(rs.getString("account_type"));
            if (type == AccountType.ASSET) {
                deltas[0] = delta;
            } else {
                deltas[1] = delta;
            }
        }, params.toArray());

        OpeningBalances opening = getOpeningBalances(from);
        BigDecimal asset = opening.getAsset();
        BigDecimal liability = opening.getLiability();
        List<AssetsTrendPoint> points = new ArrayList<>(buckets.size());
        for (Map.Entry<String, BigDecimal[]> bucket : buckets.entrySet()) {
            asset = asset.add(bucket.getValue()[0]);
            liability = liability.add(bucket.getValue()[1]);
            points.add(new AssetsTrendPoint(
                bucket.getKey(),
                Amounts.normalize(asset),
                Amounts.normalize(liability),
                Amounts.normalize(asset.subtract(liability))
            ));
        }
        log.debug("Assets trend: granularity={}, from={}, to={}, points={}", granularity, from, to, points.size());
        return points;
    }

    /**
     * Cumulative ASSET and LIAB activity strictly before {@code from}; zero for an open range.
     */
    public OpeningBalances getOpeningBalances(LocalDate from) {
        if (from == null) {
            return OpeningBalances.ZERO;
        }
        BigDecimal[] opening = {BigDecimal.ZERO, BigDecimal.ZERO};
        jdbcTemplate.query(
            "SELECT a.account_type, SUM(" + SIGNED_AMOUNT + ") AS delta_amount " +
            "FROM gl_entry_item ei " +
            "JOIN gl_entry e ON e.entry_uuid = ei.entry_uuid " +
            "JOIN gl_account a ON a.account_code = ei.account_code " +
            "WHERE a.is_active = 1 AND a.account_type IN ('ASSET','LIAB') AND e.accounting_date < ? " +
            "GROUP BY a.account_type",
            rs -> {
                BigDecimal delta = Amounts.readOrZero(rs, "delta_amount");
                if (AccountType.fromDbValue(rs.getString("account_type")) == AccountType.ASSET) {
                    opening[0] = delta;
                } else {
                    opening[1] = delta;
                }
            },
            from.toString());
        return new OpeningBalances(opening[0], opening[1]);
    }

    private static void appendDateRange(StringBuilder sql, List<Object> params, LocalDate from, LocalDate to) {
        if (from != null) {
            sql.append(" AND e.accounting_date >= ?");
            params.add(from.toString());
        }
        if (to != null) {
            sql.append(" AND e.accounting_date <= ?");
            params.add(to.toString());
        }
    }
}
