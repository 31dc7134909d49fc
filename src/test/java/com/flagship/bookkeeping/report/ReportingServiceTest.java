package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.LedgerTestDatabase;
import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LineItem;
import com.flagship.bookkeeping.result.LedgerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Report projections over a small fixed ledger:
 * 2024-01-10 food 20 paid cash, 2024-02-05 salary 100 into cash, 2024-02-20 household 30 on card.
 */
@SpringBootTest
class ReportingServiceTest {

    private static final String FOOD = "5000000001";
    private static final String HOUSEHOLD = "5000000007";
    private static final String INCOME = "4000000000";
    private static final String CARD = "1000000001";

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "reporting");
    }

    @Autowired
    private ReportingService reportingService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private ChartOfAccountsService chartOfAccounts;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID foodEntry;
    private UUID householdEntry;

    @BeforeEach
    void setUp() {
        LedgerTestDatabase.clean(jdbcTemplate);
        foodEntry = post("2024-01-10", EntryType.EXPENSE, "Tesco",
            LineItem.debit(FOOD, new BigDecimal("20"), "GBP"),
            LineItem.credit(Account.CASH_CODE, new BigDecimal("20"), "GBP"));
        post("2024-02-05", EntryType.GENERAL, "Salary",
            LineItem.debit(Account.CASH_CODE, new BigDecimal("100"), "GBP"),
            LineItem.credit(INCOME, new BigDecimal("100"), "GBP"));
        householdEntry = post("2024-02-20", EntryType.EXPENSE, "Market",
            LineItem.debit(HOUSEHOLD, new BigDecimal("30"), "GBP"),
            LineItem.credit(CARD, new BigDecimal("30"), "GBP"));
    }

    private UUID post(String date, EntryType type, String title, LineItem... lines) {
        UUID entryUuid = UUID.randomUUID();
        LedgerResult<UUID> result = ledgerService.saveEntryFullReplace(
            entryUuid, date, type, title, null, List.of(lines), true);
        assertTrue(result.isSuccess(), () -> "Fixture entry refused: " + result.getError());
        return entryUuid;
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Balance sheet lists accounts without activity with balance 0")
    void testBalanceSheet_ZeroBalanceRow() {
        printTestHeader("Balance Sheet Zero Balance Row");

        Account bank = chartOfAccounts.createUserManagedAccount("Bank", AccountType.ASSET, true).getValue();
        chartOfAccounts.createUserManagedAccount("Closed", AccountType.ASSET, false);

        List<BalanceSheetRow> rows = reportingService.getBalanceSheet();
        rows.forEach(row -> System.out.println("  " + row));

        assertEquals(List.of(Account.CASH_CODE, bank.getCode(), CARD),
            rows.stream().map(BalanceSheetRow::getAccountCode).collect(Collectors.toList()));
        assertEquals(0, new BigDecimal("80").compareTo(rows.get(0).getBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(rows.get(1).getBalance()));
        assertEquals(0, new BigDecimal("-30").compareTo(rows.get(2).getBalance()));
        assertEquals("cash", rows.get(0).getIconKey());
        assertEquals("bank", rows.get(1).getIconKey());
        assertEquals("card", rows.get(2).getIconKey());

        printSuccess("Bank listed at 0, inactive account hidden");
    }

    @Test
    @DisplayName("Journal is newest first with lines in order")
    void testJournalOrdering() {
        printTestHeader("Journal Ordering");

        List<JournalRow> cash = reportingService.listAccountTransactions(Account.CASH_CODE);
        cash.forEach(row -> System.out.println("  " + row));

        assertEquals(2, cash.size());
        assertEquals(LocalDate.of(2024, 2, 5), cash.get(0).getAccountingDate());
        assertEquals(LocalDate.of(2024, 1, 10), cash.get(1).getAccountingDate());
        assertEquals(foodEntry, cash.get(1).getEntryUuid());

        List<JournalRow> all = reportingService.listJournal(null, null);
        assertEquals(6, all.size());
        assertEquals(householdEntry, all.get(0).getEntryUuid());
        assertEquals("Household supplies", all.get(0).getAccountName());
        assertEquals("Dummy Credit card", all.get(1).getAccountName());

        printSuccess("Date descending, line number ascending");
    }

    @Test
    @DisplayName("Expense list only holds EXPENSE lines with category icons")
    void testExpenseList() {
        printTestHeader("Expense List");

        List<JournalRow> rows = reportingService.listExpenseList();

        assertEquals(2, rows.size());
        assertTrue(rows.stream().allMatch(r -> r.getAccountType() == AccountType.EXPENSE));
        assertEquals("household", rows.get(0).getIconKey());
        assertEquals("dining", rows.get(1).getIconKey());
        assertEquals("Market", rows.get(0).getEntryTitle());

        printSuccess("2 expense rows");
    }

    @Test
    @DisplayName("Lines on inactive accounts are left out of every report")
    void testInactiveAccountsExcluded() {
        printTestHeader("Inactive Accounts Excluded");

        jdbcTemplate.update("UPDATE gl_account SET is_active = 0 WHERE account_code = ?", CARD);

        assertTrue(reportingService.listAccountTransactions(CARD).isEmpty());
        assertTrue(reportingService.getBalanceSheet().stream().noneMatch(r -> r.getAccountCode().equals(CARD)));

        printSuccess("Card hidden after deactivation");
    }

    @Test
    @DisplayName("Monthly expense trend groups by label and category")
    void testExpenseTrend_Monthly() {
        printTestHeader("Monthly Expense Trend");

        List<ExpenseTrendPoint> points = reportingService.listExpenseTrend(
            Granularity.MONTH, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 31));
        points.forEach(p -> System.out.println("  " + p));

        assertEquals(2, points.size());
        assertEquals("2024-01", points.get(0).getLabel());
        assertEquals(FOOD, points.get(0).getAccountCode());
        assertEquals(0, new BigDecimal("20").compareTo(points.get(0).getAmount()));
        assertEquals("2024-02", points.get(1).getLabel());
        assertEquals(HOUSEHOLD, points.get(1).getAccountCode());

        List<ExpenseTrendPoint> february = reportingService.listExpenseTrend(
            Granularity.DAY, LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 20));
        assertEquals(1, february.size());
        assertEquals("2024-02-20", february.get(0).getLabel());

        printSuccess("Buckets and inclusive bounds hold");
    }

    @Test
    @DisplayName("Assets trend starts from prior activity, not from zero")
    void testAssetsTrend_OpeningBalance() {
        printTestHeader("Assets Trend Opening Balance");

        LocalDate from = LocalDate.of(2024, 2, 1);
        OpeningBalances opening = reportingService.getOpeningBalances(from);
        System.out.println("Opening: " + opening);

        assertEquals(0, new BigDecimal("-20").compareTo(opening.getAsset()));
        assertEquals(0, BigDecimal.ZERO.compareTo(opening.getLiability()));

        List<AssetsTrendPoint> points = reportingService.listAssetsTrend(Granularity.DAY, from, LocalDate.of(2024, 2, 29));
        points.forEach(p -> System.out.println("  " + p));

        assertEquals(2, points.size());
        assertEquals("2024-02-05", points.get(0).getLabel());
        assertEquals(0, new BigDecimal("80").compareTo(points.get(0).getAssetBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(points.get(0).getLiabilityBalance()));
        assertEquals("2024-02-20", points.get(1).getLabel());
        assertEquals(0, new BigDecimal("80").compareTo(points.get(1).getAssetBalance()));
        assertEquals(0, new BigDecimal("-30").compareTo(points.get(1).getLiabilityBalance()));
        assertEquals(0, new BigDecimal("110").compareTo(points.get(1).getNetAssets()));

        printSuccess("Opening balance of -20 carried into the window");
    }

    @Test
    @DisplayName("Open range has zero opening balances")
    void testOpenRange() {
        printTestHeader("Open Range");

        assertSame(OpeningBalances.ZERO, reportingService.getOpeningBalances(null));
        List<AssetsTrendPoint> points = reportingService.listAssetsTrend(Granularity.MONTH, null, null);
        assertEquals(List.of("2024-01", "2024-02"),
            points.stream().map(AssetsTrendPoint::getLabel).collect(Collectors.toList()));
        Optional<AssetsTrendPoint> last = points.stream().reduce((a, b) -> b);
        assertEquals(0, new BigDecimal("80").compareTo(last.get().getAssetBalance()));

        printSuccess("Trend over all time");
    }
}
