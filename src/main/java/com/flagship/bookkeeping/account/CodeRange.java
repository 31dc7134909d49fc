package com.flagship.bookkeeping.account;

/**
 * Numeric range of 10-digit account codes reserved for one user-managed account type.
 *
 * Allocation scans by code prefix (the GLOB pattern), not by stored type, so a row whose
 * stored type disagrees with its code prefix still blocks its code.
 */
public enum CodeRange {
    ASSET("1?????????", 1_000_000_000L, 1_999_999_999L),
    LIAB("2?????????", 2_000_000_000L, 2_999_999_999L);

    private final String globPattern;
    private final long floor;
    private final long ceiling;

    CodeRange(String globPattern, long floor, long ceiling) {
        this.globPattern = globPattern;
        this.floor = floor;
        this.ceiling = ceiling;
    }

    public String getGlobPattern() {
        return globPattern;
    }

    public long getFloor() {
        return floor;
    }

    public long getCeiling() {
        return ceiling;
    }

    public boolean contains(String code) {
        if (code == null || code.length() != 10) {
            return false;
        }
        try {
            long value = Long.parseLong(code);
            return value >= floor && value <= ceiling;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Formats a numeric code as the zero-padded 10-digit string stored in the database.
     */
    public static String format(long code) {
        return String.format("%010d", code);
    }
}
