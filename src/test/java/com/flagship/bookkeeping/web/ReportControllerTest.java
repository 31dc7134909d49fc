package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.LedgerTestDatabase;
import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class ReportControllerTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "report-api");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        LedgerTestDatabase.clean(jdbcTemplate);
        ledgerService.saveEntryFullReplace(UUID.randomUUID(), "2024-01-10", EntryType.EXPENSE, "Tesco", null, List.of(
            LineItem.debit("5000000001", new BigDecimal("1234.5"), "GBP"),
            LineItem.credit(Account.CASH_CODE, new BigDecimal("1234.5"), "GBP")), true);
        ledgerService.saveEntryFullReplace(UUID.randomUUID(), "2024-03-02", EntryType.EXPENSE, "Shell", null, List.of(
            LineItem.debit("5000000004", new BigDecimal("40"), "GBP"),
            LineItem.credit("1000000001", new BigDecimal("40"), "GBP")), true);
    }

    @Test
    @DisplayName("Balance sheet rows carry formatted amounts")
    void testBalanceSheet() throws Exception {
        mockMvc.perform(get("/api/reports/balance-sheet"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].account_code").value("0000000001"))
            .andExpect(jsonPath("$[0].balance_text").value("-GBP 1,234.50"))
            .andExpect(jsonPath("$[1].account_type").value("LIAB"))
            .andExpect(jsonPath("$[1].icon_key").value("card"));
    }

    @Test
    @DisplayName("Journal and expense list are newest first")
    void testJournal() throws Exception {
        mockMvc.perform(get("/api/reports/expenses"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].title").value("Shell"))
            .andExpect(jsonPath("$[1].amount_text").value("GBP 1,234.50"));

        mockMvc.perform(get("/api/reports/journal").param("account_code", "0000000001"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].icon_key").value("cash"));

        mockMvc.perform(get("/api/reports/journal").param("account_type", "LIAB"))
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    @DisplayName("Auto granularity resolves to MONTH over a long range")
    void testTrends() throws Exception {
        mockMvc.perform(get("/api/reports/expense-trend")
                .param("from", "2024-01-01").param("to", "2024-03-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.granularity").value("MONTH"))
            .andExpect(jsonPath("$.points", hasSize(2)))
            .andExpect(jsonPath("$.points[0].label").value("2024-01"))
            .andExpect(jsonPath("$.points[1].icon_key").value("transport"));

        mockMvc.perform(get("/api/reports/assets-trend")
                .param("granularity", "day").param("from", "2024-03-01").param("to", "2024-03-31"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.granularity").value("DAY"))
            .andExpect(jsonPath("$.points", hasSize(1)))
            .andExpect(jsonPath("$.points[0].asset_balance").value(-1234.5))
            .andExpect(jsonPath("$.points[0].liab_balance").value(-40));

        mockMvc.perform(get("/api/reports/assets-trend")
                .param("granularity", "week").param("from", "2024-03-01").param("to", "2024-03-31"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.field").value("granularity"));

        mockMvc.perform(get("/api/reports/expense-trend")
                .param("from", "2024-03-31").param("to", "2024-03-01"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Settings expose the domestic currency")
    void testSettings() throws Exception {
        mockMvc.perform(get("/api/settings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.currency_domestic").value("GBP"))
            .andExpect(jsonPath("$.user_name").value(""));
    }
}
