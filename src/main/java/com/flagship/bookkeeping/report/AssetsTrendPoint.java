package com.flagship.bookkeeping.report;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Running balances at the end of one bucket. {@code netAssets = assetBalance - liabilityBalance}.
 */
@Value
public class AssetsTrendPoint {
    String label;
    BigDecimal assetBalance;
    BigDecimal liabilityBalance;
    BigDecimal netAssets;
}
