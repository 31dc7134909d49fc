package com.flagship.bookkeeping.report;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Bucket size of trend series. Labels are the ISO date ({@code 2024-03-07}) or its
 * year-month prefix ({@code 2024-03}).
 */
public enum Granularity {
    DAY("e.accounting_date"),
    MONTH("substr(e.accounting_date, 1, 7)");

    static final long AUTO_MONTH_THRESHOLD_DAYS = 45;

    private final String labelExpression;

    Granularity(String labelExpression) {
        this.labelExpression = labelExpression;
    }

    String labelExpression() {
        return labelExpression;
    }

    /**
     * MONTH when the range spans more than 45 days, otherwise DAY. An open range is DAY.
     */
    public static Granularity auto(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            return DAY;
        }
        return ChronoUnit.DAYS.between(from, to) > AUTO_MONTH_THRESHOLD_DAYS ? MONTH : DAY;
    }

    /**
     * Parses {@code day}, {@code month} or {@code auto} (case-insensitive); empty for anything else.
     */
    public static Optional<Granularity> parse(String value, LocalDate from, LocalDate to) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
            return Optional.of(auto(from, to));
        }
        switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "DAY":
                return Optional.of(DAY);
            case "MONTH":
                return Optional.of(MONTH);
            default:
                return Optional.empty();
        }
    }
}
