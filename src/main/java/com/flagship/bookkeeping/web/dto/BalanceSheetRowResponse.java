package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.report.BalanceSheetRow;
import com.flagship.bookkeeping.report.MoneyFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceSheetRowResponse {

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("account_type_label")
    String accountTypeLabel;

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("balance_domestic")
    BigDecimal balanceDomestic;

    @JsonProperty("balance_text")
    String balanceText;

    @JsonProperty("icon_key")
    String iconKey;

    public static BalanceSheetRowResponse from(BalanceSheetRow row, String currency) {
        return BalanceSheetRowResponse.builder()
            .accountType(row.getAccountType())
            .accountTypeLabel(row.getAccountType().getDisplayLabel())
            .accountCode(row.getAccountCode())
            .accountName(row.getAccountName())
            .balanceDomestic(row.getBalance())
            .balanceText(MoneyFormat.format(row.getBalance(), currency))
            .iconKey(row.getIconKey())
            .build();
    }
}
