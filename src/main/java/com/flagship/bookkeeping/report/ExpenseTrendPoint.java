package com.flagship.bookkeeping.report;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class ExpenseTrendPoint {
    String label;
    String accountCode;
    String accountName;
    BigDecimal amount;
}
