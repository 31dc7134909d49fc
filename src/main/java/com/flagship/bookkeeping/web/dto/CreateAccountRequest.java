package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.account.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Request DTO for creating a user-managed ASSET or LIAB account. {@code is_active} defaults to true.
 */
@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account name is required")
    @JsonProperty("account_name")
    String accountName;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("is_active")
    Boolean active;
}
