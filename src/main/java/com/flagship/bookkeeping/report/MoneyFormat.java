package com.flagship.bookkeeping.report;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Formats domestic amounts as {@code "GBP 1,234.50"} / {@code "-GBP 1,234.50"}.
 */
public final class MoneyFormat {

    private MoneyFormat() {
    }

    public static String format(BigDecimal amount, String currency) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        // DecimalFormat is not thread-safe
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        String sign = value.signum() < 0 ? "-" : "";
        return sign + currency + " " + format.format(value.abs());
    }
}
