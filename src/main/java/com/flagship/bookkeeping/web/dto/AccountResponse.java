package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.report.IconKeys;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("account_type_label")
    String accountTypeLabel;

    @JsonProperty("is_pl")
    boolean profitAndLoss;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("is_user_managed")
    boolean userManaged;

    @JsonProperty("icon_key")
    String iconKey;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountCode(account.getCode())
            .accountName(account.getName())
            .accountType(account.getType())
            .accountTypeLabel(account.getType().getDisplayLabel())
            .profitAndLoss(account.isProfitAndLoss())
            .active(account.isActive())
            .userManaged(account.isUserManaged())
            .iconKey(IconKeys.forAccount(account.getCode(), account.getType()))
            .build();
    }
}
