package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.report.AssetsTrendPoint;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AssetsTrendPointResponse {

    @JsonProperty("label")
    String label;

    @JsonProperty("asset_balance")
    BigDecimal assetBalance;

    @JsonProperty("liab_balance")
    BigDecimal liabBalance;

    @JsonProperty("net_assets")
    BigDecimal netAssets;

    public static AssetsTrendPointResponse from(AssetsTrendPoint point) {
        return new AssetsTrendPointResponse(point.getLabel(), point.getAssetBalance(),
            point.getLiabilityBalance(), point.getNetAssets());
    }
}
