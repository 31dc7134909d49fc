package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateAccountRequest {

    @NotBlank(message = "Account name is required")
    @JsonProperty("account_name")
    String accountName;

    @NotNull(message = "is_active is required")
    @JsonProperty("is_active")
    Boolean active;
}
