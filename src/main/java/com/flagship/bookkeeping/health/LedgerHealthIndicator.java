package com.flagship.bookkeeping.health;

import com.flagship.bookkeeping.account.MasterChart;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ledger readiness: the database answers and every master account is present.
 */
@Component("ledgerHealth")
public class LedgerHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public LedgerHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            List<String> codes = MasterChart.ACCOUNTS.stream()
                .map(a -> a.getCode())
                .collect(Collectors.toList());
            String placeholders = codes.stream().map(c -> "?").collect(Collectors.joining(","));
            Integer present = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM gl_account WHERE account_code IN (" + placeholders + ")",
                Integer.class,
                codes.toArray());
            Long entries = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM gl_entry", Long.class);

            int seeded = present != null ? present : 0;
            Health.Builder builder = seeded == codes.size() ? Health.up() : Health.down();
            return builder
                .withDetail("masterAccounts", seeded)
                .withDetail("expectedMasterAccounts", codes.size())
                .withDetail("entries", entries != null ? entries : 0L)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .build();
        }
    }
}
