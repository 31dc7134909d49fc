package com.flagship.bookkeeping.config;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.MasterChart;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.EntryType;
import com.flagship.bookkeeping.ledger.LedgerService;
import com.flagship.bookkeeping.ledger.LineItem;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.setting.SettingKey;
import com.flagship.bookkeeping.setting.SettingsService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Brings the ledger database to a usable state at startup.
 *
 * Idempotent: tables are created if missing, master accounts and default settings are
 * inserted only when their key is absent, and sample entries are written only into an
 * empty ledger.
 */
@Component
@Slf4j
public class LedgerDatabaseInitializer {

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final LedgerService ledgerService;
    private final SettingsService settingsService;
    private final Clock clock;

    public LedgerDatabaseInitializer(DataSource dataSource,
                                     JdbcTemplate jdbcTemplate,
                                     LedgerProperties properties,
                                     LedgerService ledgerService,
                                     SettingsService settingsService,
                                     Clock clock) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.ledgerService = ledgerService;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
        populator.execute(dataSource);

        int accounts = 0;
        for (Account account : MasterChart.ACCOUNTS) {
            accounts += jdbcTemplate.update(
                "INSERT OR IGNORE INTO gl_account " +
                "(account_code, account_name, account_type, is_pl, is_active, is_user_managed) VALUES (?, ?, ?, ?, ?, ?)",
                account.getCode(),
                account.getName(),
                account.getType().name(),
                account.isProfitAndLoss() ? 1 : 0,
                account.isActive() ? 1 : 0,
                account.isUserManaged() ? 1 : 0
            );
        }
        insertSettingIfAbsent(SettingKey.USER_NAME, properties.getDefaultUserName());
        insertSettingIfAbsent(SettingKey.CURRENCY_DOMESTIC, properties.getDefaultDomesticCurrency());
        log.info("Ledger database initialized: {} master accounts inserted", accounts);

        if (properties.isSeedSampleData()) {
            seedSampleDataIfEmpty();
        }
    }

    /**
     * Writes three sample entries through the normal write path when the ledger is empty.
     */
    void seedSampleDataIfEmpty() {
        if (ledgerService.countEntries() > 0) {
            return;
        }
        String domestic = settingsService.getDomesticCurrency();
        LocalDate today = LocalDate.now(clock);

        List<LedgerResult<UUID>> results = List.of(
            ledgerService.saveEntryFullReplace(UUID.randomUUID(), today.minusDays(2).toString(),
                EntryType.EXPENSE, "Tesco", "Groceries",
                List.of(
                    LineItem.debit("5000000001", new BigDecimal("18.50"), domestic),
                    LineItem.debit("5000000007", new BigDecimal("6.20"), domestic),
                    LineItem.credit(Account.CASH_CODE, new BigDecimal("24.70"), domestic)
                ), true),
            ledgerService.saveEntryFullReplace(UUID.randomUUID(), today.minusDays(1).toString(),
                EntryType.EXPENSE, "Amazon US", "Foreign purchase",
                List.of(
                    foreign("5000000002", DebitCredit.D),
                    foreign(Account.CASH_CODE, DebitCredit.C)
                ), true),
            ledgerService.saveEntryFullReplace(UUID.randomUUID(), today.toString(),
                EntryType.GENERAL, "Card Payment", "Pay credit card",
                List.of(
                    LineItem.builder().accountCode("1000000001").dc(DebitCredit.D)
                        .amountDomestic(new BigDecimal("50.00")).currencyOriginal(domestic)
                        .amountOriginal(new BigDecimal("50.00")).itemText("Credit card decrease").build(),
                    LineItem.builder().accountCode(Account.CASH_CODE).dc(DebitCredit.C)
                        .amountDomestic(new BigDecimal("50.00")).currencyOriginal(domestic)
                        .amountOriginal(new BigDecimal("50.00")).itemText("Cash decrease").build()
                ), true)
        );

        long failed = results.stream().filter(LedgerResult::isFailure).count();
        if (failed > 0) {
            results.stream().filter(LedgerResult::isFailure)
                .forEach(r -> log.error("Sample entry rejected: {}", r.getError()));
            throw new IllegalStateException("Sample data seeding failed for " + failed + " entries");
        }
        log.info("Seeded {} sample entries", results.size());
    }

    private void insertSettingIfAbsent(SettingKey key, String value) {
        jdbcTemplate.update(
            "INSERT OR IGNORE INTO user_setting (setting_key, setting_value) VALUES (?, ?)",
            key.name(), value);
    }

    private static LineItem foreign(String accountCode, DebitCredit dc) {
        return LineItem.builder()
            .accountCode(accountCode)
            .dc(dc)
            .amountDomestic(new BigDecimal("30.00"))
            .currencyOriginal("USD")
            .amountOriginal(new BigDecimal("38.00"))
            .build();
    }
}
