package com.flagship.bookkeeping.health;

import com.flagship.bookkeeping.LedgerTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "health");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void restoreChart() {
        jdbcTemplate.update(
            "INSERT OR IGNORE INTO gl_account (account_code, account_name, account_type, is_pl, is_active, is_user_managed) " +
            "VALUES ('5000000010', 'Other expenses', 'EXPENSE', 1, 1, 0)");
    }

    @Test
    @DisplayName("Health is UP with the master chart present")
    void testHealthUp() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.ledger.masterAccounts").value(15))
            .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("Health is DOWN when a master account is missing")
    void testHealthDown() throws Exception {
        jdbcTemplate.update("DELETE FROM gl_account WHERE account_code = '5000000010'");

        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("DOWN"));
    }
}
