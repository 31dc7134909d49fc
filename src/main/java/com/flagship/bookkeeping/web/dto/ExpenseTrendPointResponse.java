package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.report.ExpenseTrendPoint;
import com.flagship.bookkeeping.report.IconKeys;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExpenseTrendPointResponse {

    @JsonProperty("label")
    String label;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("amount_domestic_sum")
    BigDecimal amountDomesticSum;

    @JsonProperty("icon_key")
    String iconKey;

    public static ExpenseTrendPointResponse from(ExpenseTrendPoint point) {
        return new ExpenseTrendPointResponse(point.getLabel(), point.getAccountCode(), point.getAccountName(),
            point.getAmount(), IconKeys.forAccount(point.getAccountCode(), AccountType.EXPENSE));
    }
}
