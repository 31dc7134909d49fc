package com.flagship.bookkeeping.storage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Arithmetic helpers for domestic/original amounts.
 *
 * SQLite stores NUMERIC columns as REAL, so values read back may carry binary noise
 * (e.g. {@code 24.700000000000003}); everything read from the database goes through
 * {@link #normalize(BigDecimal)}.
 */
public final class Amounts {

    /**
     * Maximum tolerated |debits - credits| for an entry.
     */
    public static final BigDecimal BALANCE_TOLERANCE = new BigDecimal("0.000001");

    /**
     * Magnitudes below this are treated as zero when parsing amounts.
     */
    public static final BigDecimal ZERO_TOLERANCE = new BigDecimal("0.000000001");

    private static final int STORED_SCALE = 6;

    private Amounts() {
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal scaled = value.setScale(STORED_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        return scaled.scale() < 0 ? scaled.setScale(0) : scaled;
    }

    public static BigDecimal read(ResultSet rs, String column) throws SQLException {
        return normalize(rs.getBigDecimal(column));
    }

    /**
     * Reads a SUM column, treating SQL NULL (no rows) as zero.
     */
    public static BigDecimal readOrZero(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value == null ? BigDecimal.ZERO : normalize(value);
    }

    public static boolean isBalanced(BigDecimal signedSum) {
        return signedSum.abs().compareTo(BALANCE_TOLERANCE) <= 0;
    }

    public static boolean isEffectivelyZero(BigDecimal value) {
        return value.abs().compareTo(ZERO_TOLERANCE) < 0;
    }

    /**
     * True when the value survives the REAL column; larger magnitudes would be stored as Inf.
     */
    public static boolean isStorable(BigDecimal value) {
        return Double.isFinite(value.doubleValue());
    }
}
