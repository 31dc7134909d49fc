package com.flagship.bookkeeping.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.bookkeeping.LedgerTestDatabase;
import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.EntryLine;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerEntry;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.result.LedgerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Import pipeline: the rejection cases a producer is likely to hit and the shape of a
 * successful import.
 */
@SpringBootTest
class ExpenseImportServiceTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "import");
    }

    @Autowired
    private ExpenseImportService importService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        LedgerTestDatabase.clean(jdbcTemplate);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LedgerError rejected(String json) {
        LedgerResult<ExpenseImportResult> result = importService.importJson(json);
        System.out.println("Payload: " + json);
        System.out.println("Result: " + result);
        assertTrue(result.isFailure(), "Import should have been rejected");
        assertEquals(0L, ledgerService.countEntries(), "Rejected import must not write");
        return result.getError();
    }

    @Test
    @DisplayName("Missing payment_account is rejected naming the field")
    void testMissingPaymentAccount() {
        printTestHeader("Missing payment_account");

        LedgerError error = rejected("{\"lines\":[{\"expense_category\":\"Food and dining\",\"amount_domestic\":1}]}");

        assertEquals("payment_account is required.", error.getMessage());
        assertEquals("payment_account", error.getField());
        assertEquals("normalize-top", error.getContext().get("stage"));

        printSuccess("Rejected at normalize-top");
    }

    @Test
    @DisplayName("Empty lines are rejected")
    void testEmptyLines() {
        printTestHeader("Empty Lines");

        LedgerError error = rejected("{\"payment_account\":\"Cash\",\"lines\":[]}");

        assertEquals("lines must contain between 1 and 500 items.", error.getMessage());

        printSuccess("Empty array rejected");
    }

    @Test
    @DisplayName("Zero amount_domestic is rejected with its 1-based index")
    void testZeroAmount() {
        printTestHeader("Zero Amount");

        LedgerError error = rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":0}]}");

        assertEquals("lines[1].amount_domestic must be a non-zero number.", error.getMessage());
        assertEquals("1", error.getContext().get("line"));
        assertEquals("normalize-line", error.getContext().get("stage"));

        printSuccess("Zero amount rejected");
    }

    @Test
    @DisplayName("Unknown payment account is rejected naming the value")
    void testUnknownPaymentAccount() {
        printTestHeader("Unknown Payment Account");

        LedgerError error = rejected("{\"payment_account\":\"NonexistentAcct\",\"lines\":[" +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":5}]}");

        assertEquals("payment_account not found/active ASSET or LIAB account: NonexistentAcct", error.getMessage());

        printSuccess("Value named in the message");
    }

    @Test
    @DisplayName("Lines that cancel out are rejected as a zero total")
    void testCancellingLines() {
        printTestHeader("Cancelling Lines");

        LedgerError error = rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":10}," +
            "{\"expense_category\":\"Household supplies\",\"amount_domestic\":-10}]}");

        assertEquals("Total amount_domestic must not be zero.", error.getMessage());
        assertEquals("build", error.getContext().get("stage"));

        printSuccess("Zero total rejected at build");
    }

    @Test
    @DisplayName("Valid payload produces one balanced EXPENSE entry")
    void testValidImport() {
        printTestHeader("Valid Import");

        LedgerResult<ExpenseImportResult> result = importService.importJson(
            "{\"date\":\"2024-03-07\",\"store\":\" Tesco \",\"payment_account\":\"Cash\",\"lines\":[" +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":18.50}," +
            "{\"expense_category\":\"Household supplies\",\"amount_domestic\":6.20}]}");

        assertTrue(result.isSuccess(), () -> "Rejected: " + result.getError());
        ExpenseImportResult imported = result.getValue();
        System.out.println("Imported: " + imported);

        assertEquals(LocalDate.of(2024, 3, 7), imported.getAccountingDate());
        assertEquals("GBP", imported.getCurrencyOriginal());
        assertEquals(2, imported.getLineCount());
        assertEquals(0, new BigDecimal("24.70").compareTo(imported.getTotalAmountDomestic()));

        LedgerEntry entry = ledgerService.getEntry(imported.getEntryUuid()).orElseThrow();
        List<EntryLine> lines = entry.getLines();
        lines.forEach(line -> System.out.println("  " + line));

        assertEquals(EntryType.EXPENSE, entry.getHeader().getEntryType());
        assertEquals("Tesco", entry.getHeader().getEntryTitle());
        assertEquals(3, lines.size());
        assertEquals(AccountType.EXPENSE, lines.get(0).getAccountType());
        assertEquals(0, new BigDecimal("18.50").compareTo(lines.get(0).getAmountDomestic()));
        assertEquals(0, new BigDecimal("6.20").compareTo(lines.get(1).getAmountDomestic()));
        assertEquals(Account.CASH_CODE, lines.get(2).getAccountCode());
        assertEquals(DebitCredit.C, lines.get(2).getDc());
        assertEquals(0, new BigDecimal("24.70").compareTo(lines.get(2).getAmountDomestic()));

        BigDecimal balance = lines.stream()
            .map(line -> line.getDc().signed(line.getAmountDomestic()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, balance.compareTo(BigDecimal.ZERO));

        printSuccess("3 lines, balance 0");
    }

    @Test
    @DisplayName("Unknown keys are rejected at both levels")
    void testUnexpectedFields() {
        printTestHeader("Unexpected Fields");

        assertEquals("Unexpected fields: total, vendor", rejected(
            "{\"payment_account\":\"Cash\",\"vendor\":\"x\",\"total\":1,\"lines\":[]}").getMessage());
        assertEquals("lines[2] unexpected fields: qty", rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":1}," +
            "{\"expense_category\":\"Food and dining\",\"amount_domestic\":1,\"qty\":2}]}").getMessage());

        printSuccess("Extra keys never ignored");
    }

    @Test
    @DisplayName("Currency is upper-cased and foreign amounts default to domestic")
    void testCurrencyAndNumericStrings() {
        printTestHeader("Currency And Numeric Strings");

        LedgerResult<ExpenseImportResult> result = importService.importJson(
            "{\"payment_account\":\"dummy credit card\",\"currency_original\":\"usd\",\"date\":null,\"lines\":[" +
            "{\"expense_category\":\"transportation\",\"amount_domestic\":\"12.5\",\"amount_original\":\"15\"," +
            "\"note\":\"taxi\"}]}");

        assertTrue(result.isSuccess(), () -> "Rejected: " + result.getError());
        assertEquals("USD", result.getValue().getCurrencyOriginal());
        assertNotNull(result.getValue().getAccountingDate());

        List<EntryLine> lines = ledgerService.getEntryLines(result.getValue().getEntryUuid());
        assertEquals("taxi", lines.get(0).getItemText());
        assertEquals(0, new BigDecimal("15").compareTo(lines.get(0).getAmountOriginal()));
        assertEquals("1000000001", lines.get(1).getAccountCode());
        assertEquals("USD", lines.get(1).getCurrencyOriginal());

        assertEquals("currency_original must be a 3-letter code or null.", rejected(
            "{\"payment_account\":\"Cash\",\"currency_original\":\"US\",\"lines\":[]}").getMessage());

        printSuccess("Names resolved case-insensitively, strings parsed as numbers");
    }

    @Test
    @DisplayName("Top-level shape problems are rejected in order")
    void testTopLevelShape() {
        printTestHeader("Top-Level Shape");

        assertEquals("Top-level JSON must be an object.", rejected("[1,2]").getMessage());
        assertEquals("lines is required.", rejected("{\"payment_account\":\"Cash\"}").getMessage());
        assertEquals("date must be YYYY-MM-DD or null.",
            rejected("{\"payment_account\":\"Cash\",\"date\":\"07/03/2024\",\"lines\":[]}").getMessage());
        assertEquals("lines must be an array.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":{}}").getMessage());
        assertEquals("store must be 200 characters or less.",
            rejected("{\"payment_account\":\"Cash\",\"store\":\"" + "x".repeat(201) + "\",\"lines\":[]}").getMessage());
        assertTrue(rejected("{not json").getMessage().startsWith("Invalid JSON: "));

        printSuccess("Each shape problem named");
    }

    @Test
    @DisplayName("Inactive category and boolean amount are rejected per line")
    void testLineProblems() {
        printTestHeader("Line Problems");

        jdbcTemplate.update("UPDATE gl_account SET is_active = 0 WHERE account_code = '5000000003'");

        assertEquals("lines[1].expense_category not found/active EXPENSE account: Entertainment and leisure",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
                "{\"expense_category\":\"Entertainment and leisure\",\"amount_domestic\":3}]}").getMessage());
        assertEquals("lines[1].amount_domestic must be a non-zero number.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
                "{\"expense_category\":\"Food and dining\",\"amount_domestic\":true}]}").getMessage());
        assertEquals("lines[1].expense_category must be a non-empty string.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[{\"amount_domestic\":3}]}").getMessage());

        printSuccess("Line problems reported with index");
    }

    @Test
    @DisplayName("Amounts beyond the storable range are rejected as strings and as numbers")
    void testOutOfRangeAmounts() {
        printTestHeader("Out Of Range Amounts");

        assertEquals("lines[1].amount_domestic must be a non-zero number.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
                "{\"expense_category\":\"Food and dining\",\"amount_domestic\":\"1e400\"}]}").getMessage());
        assertEquals("lines[1].amount_domestic must be a non-zero number.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
                "{\"expense_category\":\"Food and dining\",\"amount_domestic\":1e400}]}").getMessage());
        assertEquals("lines[2].amount_domestic must be a non-zero number.",
            rejected("{\"payment_account\":\"Cash\",\"lines\":[" +
                "{\"expense_category\":\"Food and dining\",\"amount_domestic\":\"5\"}," +
                "{\"expense_category\":\"Housing\",\"amount_domestic\":\"-1e400\"}]}").getMessage());
        assertEquals("lines[1].amount_original must be a non-zero number.",
            rejected("{\"payment_account\":\"Cash\",\"currency_original\":\"USD\",\"lines\":[" +
                "{\"expense_category\":\"Food and dining\",\"amount_domestic\":5,\"amount_original\":\"1e400\"}]}")
                .getMessage());

        printSuccess("Oversized amounts never reach the ledger");
    }

    @Test
    @DisplayName("User-managed payment accounts resolve by name")
    void testUserManagedPaymentAccount() {
        printTestHeader("User-Managed Payment Account");

        Account bank = chartOfAccounts.createUserManagedAccount("Monzo", AccountType.ASSET, true).getValue();

        LedgerResult<ExpenseImportResult> result = importService.importJson("{\"payment_account\":\"monzo\"," +
            "\"lines\":[{\"expense_category\":\"Housing\",\"amount_domestic\":700}]}");

        assertTrue(result.isSuccess(), () -> "Rejected: " + result.getError());
        List<EntryLine> lines = ledgerService.getEntryLines(result.getValue().getEntryUuid());
        assertEquals(bank.getCode(), lines.get(1).getAccountCode());

        printSuccess("Monzo resolved to " + bank.getCode());
    }

    @Test
    @DisplayName("Import from file reads UTF-8 JSON and reports unreadable files")
    void testImportFile(@TempDir Path dir) throws IOException {
        printTestHeader("Import File");

        Path file = dir.resolve("receipt.json");
        Files.writeString(file, "{\"store\":\"Café Nero\",\"payment_account\":\"Cash\"," +
            "\"lines\":[{\"expense_category\":\"Food and dining\",\"amount_domestic\":3.40}]}", StandardCharsets.UTF_8);

        LedgerResult<ExpenseImportResult> result = importService.importFile(file);
        assertTrue(result.isSuccess(), () -> "Rejected: " + result.getError());
        assertEquals("Café Nero", ledgerService.getEntryHeader(result.getValue().getEntryUuid())
            .orElseThrow().getEntryTitle());

        LedgerResult<ExpenseImportResult> missing = importService.importFile(dir.resolve("missing.json"));
        assertTrue(missing.isFailure());
        assertTrue(missing.getError().getMessage().startsWith("Failed to read JSON file: "));
        assertEquals("read", missing.getError().getContext().get("stage"));

        printSuccess("File imported, missing file reported");
    }

    @Test
    @DisplayName("Cancellation before the write leaves the ledger untouched")
    void testCancelledBeforeWrite() {
        printTestHeader("Cancelled Before Write");

        ObjectNode line = objectMapper.createObjectNode()
            .put("expense_category", "Food and dining")
            .put("amount_domestic", 2);
        ObjectNode payload = objectMapper.createObjectNode().put("payment_account", "Cash");
        payload.putArray("lines").add(line);

        LedgerResult<ExpenseImportResult> result = importService.importPayload(payload, () -> true);

        assertTrue(result.isFailure());
        assertEquals("Import cancelled before write", result.getError().getMessage());
        assertEquals(0L, ledgerService.countEntries());

        printSuccess("Nothing written");
    }
}
