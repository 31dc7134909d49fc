package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.attachment.AttachmentStore;
import com.flagship.bookkeeping.observability.CorrelationContext;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.storage.Amounts;
import com.flagship.bookkeeping.storage.LedgerWriteSerializer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger store: entries and their lines.
 *
 * This service enforces the core invariants:
 * 1. Debits must equal credits (within {@link Amounts#BALANCE_TOLERANCE}) for every persisted entry
 * 2. Every line references an existing, active account at write time
 * 3. Create and edit share one full-replace write path; lines are renumbered from 1 on every write
 * 4. Validation and mutation happen in one serialized transaction, so a refused write leaves
 *    the previous state untouched
 *
 * There is no draft state: an entry either does not exist or is persisted and balanced.
 */
@Service
@Slf4j
public class LedgerService {

    static final DateTimeFormatter MODIFICATION_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final ChartOfAccountsService chartOfAccounts;
    private final AttachmentStore attachmentStore;
    private final LedgerWriteSerializer writeSerializer;
    private final LedgerMetrics metrics;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate,
                         ChartOfAccountsService chartOfAccounts,
                         AttachmentStore attachmentStore,
                         LedgerWriteSerializer writeSerializer,
                         LedgerMetrics metrics,
                         Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.chartOfAccounts = chartOfAccounts;
        this.attachmentStore = attachmentStore;
        this.writeSerializer = writeSerializer;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Creates or fully replaces an entry.
     *
     * Checks, in order: the accounting date is an ISO calendar date; at least one line is
     * given; every line references an existing active account, has a side, a non-zero
     * domestic amount and a currency; the signed domestic amounts sum to zero. Only then is
     * the header inserted (or updated, stamping the modification date), the old lines
     * deleted and the submitted lines inserted as 1..N in submission order.
     *
     * @param isNew true to create; false to replace an existing entry
     * @return the entry id, or the first reason the write was refused
     */
    public LedgerResult<UUID> saveEntryFullReplace(UUID entryUuid,
                                                   String accountingDate,
                                                   EntryType entryType,
                                                   String entryTitle,
                                                   String entryText,
                                                   List<LineItem> lines,
                                                   boolean isNew) {
        if (entryUuid == null) {
            return rejected(LedgerResult.failure(ErrorKind.VALIDATION, "entry_uuid", "entry_uuid is required"));
        }
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryUuid.toString());
        try {
            LedgerResult<UUID> result = writeSerializer.write(isNew ? "create-entry" : "replace-entry", () -> {
                LedgerResult<LocalDate> date = parseAccountingDate(accountingDate);
                if (date.isFailure()) {
                    return date.castFailure();
                }
                if (entryType == null) {
                    return LedgerResult.failure(ErrorKind.VALIDATION, "entry_type", "entry_type must be EXPENSE or GENERAL");
                }
                if (lines == null || lines.isEmpty()) {
                    return LedgerResult.failure(ErrorKind.VALIDATION, "lines", "At least one item is required");
                }
                LedgerResult<Void> linesValid = validateLines(lines);
                if (linesValid.isFailure()) {
                    return linesValid.castFailure();
                }
                LedgerResult<Void> balanced = checkBalance(lines);
                if (balanced.isFailure()) {
                    return balanced.castFailure();
                }

                boolean exists = entryExists(entryUuid);
                if (isNew && exists) {
                    return LedgerResult.failure(LedgerError.validation("entry_uuid",
                        "Entry already exists: " + entryUuid).with("entry_uuid", entryUuid));
                }
                if (!isNew && !exists) {
                    return LedgerResult.failure(LedgerError.notFound("entry_uuid",
                        "Entry not found: " + entryUuid).with("entry_uuid", entryUuid));
                }

                writeHeader(entryUuid, date.getValue(), entryType, blankToNull(entryTitle), blankToNull(entryText), isNew);
                replaceLines(entryUuid, lines);
                return LedgerResult.success(entryUuid);
            });

            if (result.isSuccess()) {
                metrics.recordEntrySaved(entryType, isNew);
                log.info("Entry {}: type={}, date={}, lines={}, debits={}",
                    isNew ? "created" : "replaced", entryType, accountingDate, lines.size(), debitTotal(lines));
            }
            return rejected(result);
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    /**
     * Deletes an entry, its lines and its attachment in one transaction. Irreversible.
     *
     * @return the deleted id, or NOT_FOUND if there is no such entry
     */
    public LedgerResult<UUID> deleteEntry(UUID entryUuid) {
        if (entryUuid == null) {
            return LedgerResult.failure(ErrorKind.VALIDATION, "entry_uuid", "entry_uuid is required");
        }
        MDC.put(CorrelationContext.ENTRY_ID_MDC_KEY, entryUuid.toString());
        try {
            LedgerResult<UUID> result = writeSerializer.write("delete-entry", () -> {
                if (!entryExists(entryUuid)) {
                    return LedgerResult.failure(LedgerError.notFound("entry_uuid",
                        "Entry not found: " + entryUuid).with("entry_uuid", entryUuid));
                }
                if (attachmentStore.exists(entryUuid)) {
                    LedgerResult<Boolean> removed = attachmentStore.delete(entryUuid);
                    if (removed.isFailure()) {
                        return removed.castFailure();
                    }
                }
                int lineCount = jdbcTemplate.update("DELETE FROM gl_entry_item WHERE entry_uuid = ?", entryUuid.toString());
                jdbcTemplate.update("DELETE FROM gl_entry WHERE entry_uuid = ?", entryUuid.toString());
                log.info("Entry deleted with {} lines", lineCount);
                return LedgerResult.success(entryUuid);
            });
            if (result.isSuccess()) {
                metrics.incrementEntriesDeleted();
            } else {
                log.warn("Entry delete refused: {}", result.getError());
            }
            return result;
        } finally {
            MDC.remove(CorrelationContext.ENTRY_ID_MDC_KEY);
        }
    }

    public Optional<EntryHeader> getEntryHeader(UUID entryUuid) {
        List<EntryHeader> rows = jdbcTemplate.query(
            "SELECT entry_uuid, modification_date, accounting_date, entry_type, entry_title, entry_text " +
            "FROM gl_entry WHERE entry_uuid = ?",
            entryHeaderRowMapper(),
            entryUuid.toString()
        );
        return rows.stream().findFirst();
    }

    /**
     * Lines of an entry joined with account name and type, in line order.
     * An unknown entry yields an empty list.
     */
    public List<EntryLine> getEntryLines(UUID entryUuid) {
        return jdbcTemplate.query(
            "SELECT ei.entry_uuid, ei.line_no, ei.account_code, a.account_name, a.account_type, ei.dc, " +
            "ei.amount_domestic, ei.currency_original, ei.amount_original, ei.item_text " +
            "FROM gl_entry_item ei " +
            "JOIN gl_account a ON a.account_code = ei.account_code " +
            "WHERE ei.entry_uuid = ? " +
            "ORDER BY ei.line_no",
            entryLineRowMapper(),
            entryUuid.toString()
        );
    }

    /**
     * Header and lines read together; empty if the entry does not exist.
     */
    public Optional<LedgerEntry> getEntry(UUID entryUuid) {
        return getEntryHeader(entryUuid)
            .map(header -> new LedgerEntry(header, getEntryLines(entryUuid)));
    }

    public boolean entryExists(UUID entryUuid) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM gl_entry WHERE entry_uuid = ?", Integer.class, entryUuid.toString());
        return count != null && count > 0;
    }

    public long countEntries() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM gl_entry", Long.class);
        return count != null ? count : 0L;
    }

    static LedgerResult<LocalDate> parseAccountingDate(String accountingDate) {
        if (accountingDate == null || accountingDate.length() != 10) {
            return LedgerResult.failure(LedgerError.validation("accounting_date",
                "accounting_date must be ISO date YYYY-MM-DD").with("accounting_date", accountingDate));
        }
        try {
            return LedgerResult.success(LocalDate.parse(accountingDate));
        } catch (DateTimeParseException e) {
            return LedgerResult.failure(LedgerError.validation("accounting_date",
                "accounting_date must be ISO date YYYY-MM-DD").with("accounting_date", accountingDate));
        }
    }

    private LedgerResult<Void> validateLines(List<LineItem> lines) {
        for (int i = 0; i < lines.size(); i++) {
            LineItem line = lines.get(i);
            int lineNo = i + 1;
            if (line == null) {
                return LedgerResult.failure(LedgerError.validation("lines",
                    "Line " + lineNo + " is missing").with("line_no", lineNo));
            }
            String code = line.getAccountCode();
            Optional<Account> account = chartOfAccounts.findByCode(code);
            if (account.isEmpty()) {
                return LedgerResult.failure(LedgerError.of(ErrorKind.REFERENTIAL, "account_code",
                    "Unknown account_code: " + code).with("account_code", code).with("line_no", lineNo));
            }
            if (!account.get().isActive()) {
                return LedgerResult.failure(LedgerError.of(ErrorKind.REFERENTIAL, "account_code",
                    "Inactive account_code: " + code).with("account_code", code).with("line_no", lineNo));
            }
            if (line.getDc() == null) {
                return LedgerResult.failure(LedgerError.validation("dc",
                    "dc must be D or C (account_code " + code + ")").with("account_code", code).with("line_no", lineNo));
            }
            if (line.getAmountDomestic() == null || Amounts.isEffectivelyZero(line.getAmountDomestic())) {
                return LedgerResult.failure(LedgerError.validation("amount_domestic",
                    "amount_domestic must be a non-zero number (account_code " + code + ")")
                    .with("account_code", code).with("line_no", lineNo));
            }
            if (!Amounts.isStorable(line.getAmountDomestic())) {
                return LedgerResult.failure(LedgerError.validation("amount_domestic",
                    "amount_domestic is out of range (account_code " + code + ")")
                    .with("account_code", code).with("line_no", lineNo));
            }
            if (line.getAmountOriginal() != null && !Amounts.isStorable(line.getAmountOriginal())) {
                return LedgerResult.failure(LedgerError.validation("amount_original",
                    "amount_original is out of range (account_code " + code + ")")
                    .with("account_code", code).with("line_no", lineNo));
            }
            if (line.getCurrencyOriginal() == null || line.getCurrencyOriginal().isBlank()) {
                return LedgerResult.failure(LedgerError.validation("currency_original",
                    "currency_original is required (account_code " + code + ")")
                    .with("account_code", code).with("line_no", lineNo));
            }
        }
        return LedgerResult.success(null);
    }

    /**
     * Signed balance over the lines: debits positive, credits negative. Must be zero within tolerance.
     */
    static LedgerResult<Void> checkBalance(List<LineItem> lines) {
        BigDecimal balance = lines.stream()
            .map(LineItem::signedAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (!Amounts.isBalanced(balance)) {
            return LedgerResult.failure(LedgerError.validation("lines",
                String.format("Debit/Credit not balanced (domestic). diff=%.6f", balance))
                .with("diff", balance.toPlainString()));
        }
        return LedgerResult.success(null);
    }

    private void writeHeader(UUID entryUuid, LocalDate accountingDate, EntryType entryType,
                             String entryTitle, String entryText, boolean isNew) {
        String modificationDate = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(MODIFICATION_FORMAT);
        if (isNew) {
            jdbcTemplate.update(
                "INSERT INTO gl_entry (entry_uuid, modification_date, accounting_date, entry_type, entry_title, entry_text) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                entryUuid.toString(), modificationDate, accountingDate.toString(), entryType.name(), entryTitle, entryText
            );
        } else {
            jdbcTemplate.update(
                "UPDATE gl_entry SET modification_date = ?, accounting_date = ?, entry_type = ?, entry_title = ?, entry_text = ? " +
                "WHERE entry_uuid = ?",
                modificationDate, accountingDate.toString(), entryType.name(), entryTitle, entryText, entryUuid.toString()
            );
        }
    }

    private void replaceLines(UUID entryUuid, List<LineItem> lines) {
        jdbcTemplate.update("DELETE FROM gl_entry_item WHERE entry_uuid = ?", entryUuid.toString());
        List<Object[]> rows = new ArrayList<>(lines.size());
        int lineNo = 1;
        for (LineItem line : lines) {
            rows.add(new Object[] {
                entryUuid.toString(),
                lineNo++,
                line.getAccountCode(),
                line.getDc().name(),
                line.getAmountDomestic(),
                line.getCurrencyOriginal(),
                line.getAmountOriginal(),
                blankToNull(line.getItemText())
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO gl_entry_item (entry_uuid, line_no, account_code, dc, amount_domestic, " +
            "currency_original, amount_original, item_text) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            rows
        );
    }

    private LedgerResult<UUID> rejected(LedgerResult<UUID> result) {
        if (result.isFailure()) {
            metrics.recordEntryRejected(result.getError().getKind());
            log.warn("Entry write refused: {}", result.getError());
        }
        return result;
    }

    private static BigDecimal debitTotal(List<LineItem> lines) {
        return lines.stream()
            .filter(l -> l.getDc() == DebitCredit.D)
            .map(LineItem::getAmountDomestic)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private RowMapper<EntryHeader> entryHeaderRowMapper() {
        return (rs, rowNum) -> new EntryHeader(
            UUID.fromString(rs.getString("entry_uuid")),
            LocalDateTime.parse(rs.getString("modification_date")),
            LocalDate.parse(rs.getString("accounting_date")),
            EntryType.fromDbValue(rs.getString("entry_type")),
            rs.getString("entry_title"),
            rs.getString("entry_text")
        );
    }

    private RowMapper<EntryLine> entryLineRowMapper() {
        return (rs, rowNum) -> new EntryLine(
            UUID.fromString(rs.getString("entry_uuid")),
            rs.getInt("line_no"),
            rs.getString("account_code"),
            rs.getString("account_name"),
            AccountType.fromDbValue(rs.getString("account_type")),
            DebitCredit.fromDbValue(rs.getString("dc")),
            Amounts.read(rs, "amount_domestic"),
            rs.getString("currency_original"),
            Amounts.read(rs, "amount_original"),
            rs.getString("item_text")
        );
    }
}
