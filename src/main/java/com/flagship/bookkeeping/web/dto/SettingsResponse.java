package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class SettingsResponse {

    @JsonProperty("user_name")
    String userName;

    @JsonProperty("currency_domestic")
    String currencyDomestic;
}
