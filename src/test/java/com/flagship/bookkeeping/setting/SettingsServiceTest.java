package com.flagship.bookkeeping.setting;

import com.flagship.bookkeeping.LedgerTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SettingsServiceTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "settings");
        registry.add("ledger.default-domestic-currency", () -> "EUR");
        registry.add("ledger.default-user-name", () -> "Alex");
    }

    @Autowired
    private SettingsService settingsService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void restore() {
        jdbcTemplate.update("INSERT OR REPLACE INTO user_setting (setting_key, setting_value) VALUES ('CURRENCY_DOMESTIC', 'EUR')");
    }

    @Test
    @DisplayName("Settings are seeded from configuration on first start")
    void testSeededFromProperties() {
        assertEquals("EUR", settingsService.getDomesticCurrency());
        assertEquals("Alex", settingsService.getUserName());
        assertEquals("Alex", settingsService.getSetting(SettingKey.USER_NAME).orElseThrow());
    }

    @Test
    @DisplayName("Blank or missing domestic currency falls back to GBP")
    void testCurrencyFallback() {
        jdbcTemplate.update("UPDATE user_setting SET setting_value = '  ' WHERE setting_key = 'CURRENCY_DOMESTIC'");
        assertEquals(SettingsService.FALLBACK_DOMESTIC_CURRENCY, settingsService.getDomesticCurrency());

        jdbcTemplate.update("DELETE FROM user_setting WHERE setting_key = 'CURRENCY_DOMESTIC'");
        assertEquals("GBP", settingsService.getDomesticCurrency());
        assertTrue(settingsService.getSetting(SettingKey.CURRENCY_DOMESTIC).isEmpty());
    }
}
