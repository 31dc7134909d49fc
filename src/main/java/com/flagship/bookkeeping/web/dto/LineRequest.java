package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.ledger.DebitCredit;
import com.flagship.bookkeeping.ledger.LineItem;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One submitted entry line. Only shape is checked here; the ledger validates content.
 */
@Value
public class LineRequest {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("dc")
    DebitCredit dc;

    @JsonProperty("amount_domestic")
    BigDecimal amountDomestic;

    @JsonProperty("currency_original")
    String currencyOriginal;

    @JsonProperty("amount_original")
    BigDecimal amountOriginal;

    @JsonProperty("item_text")
    String itemText;

    public LineItem toLineItem() {
        return LineItem.builder()
            .accountCode(accountCode)
            .dc(dc)
            .amountDomestic(amountDomestic)
            .currencyOriginal(currencyOriginal)
            .amountOriginal(amountOriginal)
            .itemText(itemText)
            .build();
    }
}
