package com.flagship.bookkeeping.web.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.bookkeeping.result.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    ErrorKind kind;
    String field;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
