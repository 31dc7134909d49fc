package com.flagship.bookkeeping.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bookkeeping.report.Granularity;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A trend series with the granularity actually used (after resolving {@code auto}).
 */
@Value
public class TrendResponse<T> {

    @JsonProperty("granularity")
    Granularity granularity;

    @JsonProperty("date_from")
    LocalDate dateFrom;

    @JsonProperty("date_to")
    LocalDate dateTo;

    @JsonProperty("points")
    List<T> points;
}
