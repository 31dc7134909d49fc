package com.flagship.bookkeeping.report;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Cumulative ASSET and LIAB activity strictly before a trend window starts.
 */
@Value
public class OpeningBalances {
    public static final OpeningBalances ZERO = new OpeningBalances(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal asset;
    BigDecimal liability;
}
