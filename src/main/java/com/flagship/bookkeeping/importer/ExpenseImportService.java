package com.flagship.bookkeeping.importer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.config.LedgerProperties;
import com.flagship.bookkeeping.expense.BalancedItems;
import com.flagship.bookkeeping.expense.ExpenseEntryComposer;
import com.flagship.bookkeeping.expense.ExpenseLine;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.observability.LedgerMetrics;
import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.setting.SettingsService;
import com.flagship.bookkeeping.storage.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Turns an untrusted JSON expense payload into one balanced EXPENSE entry.
 *
 * Pipeline: normalize-top, normalize-line (1-based index in messages), build balanced
 * items, persist under a fresh id. Each stage stops at the first problem; unknown keys are
 * rejected, never ignored. All failures, persistence included, come back as a failed
 * result whose message can be shown as-is and whose {@code stage} context names the stage.
 *
 * Lines are not merged: a producer is expected to pre-aggregate identical categories.
 */
@Service
@Slf4j
public class ExpenseImportService {

    static final Set<String> TOP_LEVEL_FIELDS =
        Set.of("date", "store", "note", "payment_account", "currency_original", "lines");
    static final Set<String> LINE_FIELDS =
        Set.of("expense_category", "note", "amount_domestic", "amount_original");

    private final ChartOfAccountsService chartOfAccounts;
    private final ExpenseEntryComposer composer;
    private final LedgerService ledgerService;
    private final SettingsService settingsService;
    private final LedgerProperties.Importer limits;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final ObjectReader jsonReader;

    public ExpenseImportService(ChartOfAccountsService chartOfAccounts,
                                ExpenseEntryComposer composer,
                                LedgerService ledgerService,
                                SettingsService settingsService,
                                LedgerProperties properties,
                                LedgerMetrics metrics,
                                Clock clock,
                                ObjectMapper objectMapper) {
        this.chartOfAccounts = chartOfAccounts;
        this.composer = composer;
        this.ledgerService = ledgerService;
        this.settingsService = settingsService;
        this.limits = properties.getImporter();
        this.metrics = metrics;
        this.clock = clock;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Reads a UTF-8 JSON file and imports it.
     */
    public LedgerResult<ExpenseImportResult> importFile(Path path) {
        JsonNode payload;
        try {
            payload = jsonReader.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Import file unreadable: path={}, reason={}", path, e.getMessage());
            return recordOutcome(reject(ImportStage.READ, "file", "Failed to read JSON file: " + e.getMessage()));
        }
        if (payload == null || payload.isMissingNode()) {
            return recordOutcome(reject(ImportStage.READ, "file", "Failed to read JSON file: empty document"));
        }
        return importPayload(payload);
    }

    /**
     * Parses JSON text and imports it.
     */
    public LedgerResult<ExpenseImportResult> importJson(String json) {
        JsonNode payload;
        try {
            payload = jsonReader.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            return recordOutcome(reject(ImportStage.READ, "payload", "Invalid JSON: " + e.getOriginalMessage()));
        }
        if (payload == null || payload.isMissingNode()) {
            return recordOutcome(reject(ImportStage.READ, "payload", "Invalid JSON: empty document"));
        }
        return importPayload(payload);
    }

    public LedgerResult<ExpenseImportResult> importPayload(JsonNode payload) {
        return importPayload(payload, () -> false);
    }

    /**
     * Imports a parsed payload. {@code cancelled} is checked once, after validation and
     * immediately before the write; a write that has started always runs to commit or rollback.
     */
    public LedgerResult<ExpenseImportResult> importPayload(JsonNode payload, BooleanSupplier cancelled) {
        LedgerResult<NormalizedPayload> top = normalizeTop(payload);
        if (top.isFailure()) {
            return recordOutcome(top.castFailure());
        }
        NormalizedPayload data = top.getValue();

        List<ExpenseLine> lines = new ArrayList<>(data.getLines().size());
        int index = 1;
        for (JsonNode rawLine : data.getLines()) {
            LedgerResult<ExpenseLine> line = normalizeLine(index++, rawLine);
            if (line.isFailure()) {
                return recordOutcome(line.castFailure());
            }
            lines.add(line.getValue());
        }

        LedgerResult<BalancedItems> built = composer
            .buildBalancedItems(data.getPaymentAccountCode(), data.getCurrencyOriginal(), lines)
            .mapError(error -> error.with("stage", ImportStage.BUILD.getLabel()));
        if (built.isFailure()) {
            return recordOutcome(built.castFailure());
        }

        if (cancelled.getAsBoolean()) {
            log.info("Import cancelled before write");
            metrics.recordImport("cancelled");
            return reject(ImportStage.PERSIST, null, "Import cancelled before write");
        }

        UUID entryUuid = UUID.randomUUID();
        LedgerResult<UUID> saved = ledgerService.saveEntryFullReplace(
            entryUuid,
            data.getAccountingDate().toString(),
            EntryType.EXPENSE,
            data.getEntryTitle(),
            data.getEntryText(),
            built.getValue().getItems(),
            true
        ).mapError(error -> error.with("stage", ImportStage.PERSIST.getLabel()));
        if (saved.isFailure()) {
            return recordOutcome(saved.castFailure());
        }

        ExpenseImportResult result = new ExpenseImportResult(
            entryUuid,
            data.getAccountingDate(),
            data.getCurrencyOriginal(),
            built.getValue().getTotalDomestic(),
            lines.size()
        );
        log.info("Imported expense entry: entryId={}, payment={}, total={} {}, lines={}",
            entryUuid, data.getPaymentAccountName(), result.getTotalAmountDomestic(),
            result.getCurrencyOriginal(), result.getLineCount());
        return recordOutcome(LedgerResult.success(result));
    }

    LedgerResult<NormalizedPayload> normalizeTop(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return reject(ImportStage.NORMALIZE_TOP, null, "Top-level JSON must be an object.");
        }
        Set<String> extra = unexpectedFields(payload, TOP_LEVEL_FIELDS);
        if (!extra.isEmpty()) {
            return reject(ImportStage.NORMALIZE_TOP, null, "Unexpected fields: " + String.join(", ", extra));
        }
        if (!payload.has("payment_account")) {
            return reject(ImportStage.NORMALIZE_TOP, "payment_account", "payment_account is required.");
        }
        if (!payload.has("lines")) {
            return reject(ImportStage.NORMALIZE_TOP, "lines", "lines is required.");
        }

        LedgerResult<LocalDate> date = parseDate(payload.get("date"));
        if (date.isFailure()) {
            return date.castFailure();
        }
        LedgerResult<String> store = optionalText(payload.get("store"), "store", limits.getMaxStoreLength(),
            ImportStage.NORMALIZE_TOP);
        if (store.isFailure()) {
            return store.castFailure();
        }
        LedgerResult<String> note = optionalText(payload.get("note"), "note", limits.getMaxNoteLength(),
            ImportStage.NORMALIZE_TOP);
        if (note.isFailure()) {
            return note.castFailure();
        }

        JsonNode paymentNode = payload.get("payment_account");
        if (paymentNode == null || !paymentNode.isTextual() || paymentNode.asText().isBlank()) {
            return reject(ImportStage.NORMALIZE_TOP, "payment_account", "payment_account must be a non-empty string.");
        }
        String paymentName = paymentNode.asText();
        Optional<Account> payment = chartOfAccounts.findPaymentAccountByName(paymentName.trim());
        if (payment.isEmpty()) {
            return LedgerResult.failure(LedgerError.validation("payment_account",
                    "payment_account not found/active ASSET or LIAB account: " + paymentName)
                .with("payment_account", paymentName)
                .with("stage", ImportStage.NORMALIZE_TOP.getLabel()));
        }

        LedgerResult<String> currency = parseCurrency(payload.get("currency_original"));
        if (currency.isFailure()) {
            return currency.castFailure();
        }

        JsonNode lines = payload.get("lines");
        if (lines == null || !lines.isArray()) {
            return reject(ImportStage.NORMALIZE_TOP, "lines", "lines must be an array.");
        }
        if (lines.size() < 1 || lines.size() > limits.getMaxLines()) {
            return reject(ImportStage.NORMALIZE_TOP, "lines",
                "lines must contain between 1 and " + limits.getMaxLines() + " items.");
        }

        return LedgerResult.success(new NormalizedPayload(
            date.getValue(),
            store.getValue(),
            note.getValue(),
            payment.get().getCode(),
            payment.get().getName(),
            currency.getValue(),
            lines
        ));
    }

    LedgerResult<ExpenseLine> normalizeLine(int index, JsonNode line) {
        String prefix = "lines[" + index + "]";
        if (line == null || !line.isObject()) {
            return rejectLine(index, prefix, prefix + " must be an object.");
        }
        Set<String> extra = unexpectedFields(line, LINE_FIELDS);
        if (!extra.isEmpty()) {
            return rejectLine(index, prefix, prefix + " unexpected fields: " + String.join(", ", extra));
        }

        JsonNode categoryNode = line.get("expense_category");
        if (categoryNode == null || !categoryNode.isTextual() || categoryNode.asText().isBlank()) {
            return rejectLine(index, prefix + ".expense_category",
                prefix + ".expense_category must be a non-empty string.");
        }
        String categoryName = categoryNode.asText();
        Optional<Account> category = chartOfAccounts.findAccountByName(
            categoryName.trim(), EnumSet.of(AccountType.EXPENSE), true);
        if (category.isEmpty()) {
            return LedgerResult.failure(LedgerError.validation(prefix + ".expense_category",
                    prefix + ".expense_category not found/active EXPENSE account: " + categoryName)
                .with("expense_category", categoryName)
                .with("line", index)
                .with("stage", ImportStage.NORMALIZE_LINE.getLabel()));
        }

        LedgerResult<String> note = optionalText(line.get("note"), prefix + ".note", limits.getMaxNoteLength(),
            ImportStage.NORMALIZE_LINE);
        if (note.isFailure()) {
            return note.mapError(error -> error.with("line", index)).castFailure();
        }

        LedgerResult<BigDecimal> amountDomestic = parseNonZeroNumber(line.get("amount_domestic"),
            prefix + ".amount_domestic");
        if (amountDomestic.isFailure()) {
            return amountDomestic.mapError(error -> error.with("line", index)).castFailure();
        }
        JsonNode originalNode = line.get("amount_original");
        LedgerResult<BigDecimal> amountOriginal = originalNode == null || originalNode.isNull()
            ? amountDomestic
            : parseNonZeroNumber(originalNode, prefix + ".amount_original");
        if (amountOriginal.isFailure()) {
            return amountOriginal.mapError(error -> error.with("line", index)).castFailure();
        }

        return LedgerResult.success(new ExpenseLine(
            category.get().getCode(), amountDomestic.getValue(), amountOriginal.getValue(), note.getValue()));
    }

    private LedgerResult<LocalDate> parseDate(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && node.asText().isEmpty())) {
            return LedgerResult.success(LocalDate.now(clock));
        }
        if (node.isTextual()) {
            try {
                return LedgerResult.success(LocalDate.parse(node.asText()));
            } catch (DateTimeParseException e) {
                log.debug("Rejected import date '{}': {}", node.asText(), e.getMessage());
            }
        }
        return reject(ImportStage.NORMALIZE_TOP, "date", "date must be YYYY-MM-DD or null.");
    }

    private LedgerResult<String> parseCurrency(JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && node.asText().isEmpty())) {
            return LedgerResult.success(settingsService.getDomesticCurrency());
        }
        if (!node.isTextual()) {
            return reject(ImportStage.NORMALIZE_TOP, "currency_original", "currency_original must be a string or null.");
        }
        String currency = node.asText().trim().toUpperCase(Locale.ROOT);
        if (!currency.matches("[A-Z]{3}")) {
            return reject(ImportStage.NORMALIZE_TOP, "currency_original",
                "currency_original must be a 3-letter code or null.");
        }
        return LedgerResult.success(currency);
    }

    /**
     * Null/absent stays null; the length limit applies before trimming; blank becomes null.
     */
    private static LedgerResult<String> optionalText(JsonNode node, String field, int maxLength, ImportStage stage) {
        if (node == null || node.isNull()) {
            return LedgerResult.success(null);
        }
        if (!node.isTextual()) {
            return reject(stage, field, field + " must be a string or null.");
        }
        String text = node.asText();
        if (text.length() > maxLength) {
            return reject(stage, field, field + " must be " + maxLength + " characters or less.");
        }
        String trimmed = text.trim();
        return LedgerResult.success(trimmed.isEmpty() ? null : trimmed);
    }

    /**
     * Accepts JSON numbers and numeric strings; sign is allowed, zero and non-finite values are not.
     */
    static LedgerResult<BigDecimal> parseNonZeroNumber(JsonNode node, String field) {
        BigDecimal value = null;
        if (node != null && node.isNumber()) {
            try {
                value = node.decimalValue();
            } catch (NumberFormatException e) {
                value = null;
            }
        } else if (node != null && node.isTextual()) {
            try {
                value = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                value = null;
            }
        }
        if (value == null || Amounts.isEffectivelyZero(value) || !Amounts.isStorable(value)) {
            return reject(ImportStage.NORMALIZE_LINE, field, field + " must be a non-zero number.");
        }
        return LedgerResult.success(value);
    }

    private static Set<String> unexpectedFields(JsonNode node, Set<String> allowed) {
        Set<String> extra = new TreeSet<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                extra.add(name);
            }
        }
        return extra;
    }

    private static <T> LedgerResult<T> rejectLine(int index, String field, String message) {
        return LedgerResult.failure(LedgerError.validation(field, message)
            .with("line", index)
            .with("stage", ImportStage.NORMALIZE_LINE.getLabel()));
    }

    private static <T> LedgerResult<T> reject(ImportStage stage, String field, String message) {
        return LedgerResult.failure(LedgerError.of(ErrorKind.VALIDATION, field, message)
            .with("stage", stage.getLabel()));
    }

    private LedgerResult<ExpenseImportResult> recordOutcome(LedgerResult<ExpenseImportResult> result) {
        if (result.isSuccess()) {
            metrics.recordImport("success");
        } else {
            metrics.recordImport("rejected");
            log.warn("Expense import rejected at {}: {}",
                result.getError().getContext().getOrDefault("stage", "unknown"), result.getError().getMessage());
        }
        return result;
    }
}
