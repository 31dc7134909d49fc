package com.flagship.bookkeeping.setting;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read access to process-wide settings.
 *
 * Values are read on every call, so a changed domestic currency is picked up by the next
 * import or report without a restart. The ledger core never writes settings; they are
 * seeded once by {@link com.flagship.bookkeeping.config.LedgerDatabaseInitializer}.
 */
@Service
@Slf4j
public class SettingsService {

    public static final String FALLBACK_DOMESTIC_CURRENCY = "GBP";

    private final JdbcTemplate jdbcTemplate;

    public SettingsService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<String> getSetting(SettingKey key) {
        List<String> values = jdbcTemplate.queryForList(
            "SELECT setting_value FROM user_setting WHERE setting_key = ?", String.class, key.name());
        return values.stream().findFirst();
    }

    /**
     * Domestic currency code, {@value #FALLBACK_DOMESTIC_CURRENCY} when the setting is missing or blank.
     */
    public String getDomesticCurrency() {
        return getSetting(SettingKey.CURRENCY_DOMESTIC)
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .orElseGet(() -> {
                log.debug("CURRENCY_DOMESTIC not set, using {}", FALLBACK_DOMESTIC_CURRENCY);
                return FALLBACK_DOMESTIC_CURRENCY;
            });
    }

    public String getUserName() {
        return getSetting(SettingKey.USER_NAME).orElse("");
    }
}
