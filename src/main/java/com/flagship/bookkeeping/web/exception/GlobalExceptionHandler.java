package com.flagship.bookkeeping.web.exception;

import com.flagship.bookkeeping.result.ErrorKind;
import com.flagship.bookkeeping.result.LedgerError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps refused operations and malformed requests to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerOperationException.class)
    public ResponseEntity<ApiError> handleLedgerOperation(LedgerOperationException e) {
        LedgerError error = e.getError();
        HttpStatus status = statusFor(error.getKind());
        if (status.is5xxServerError()) {
            log.error("Ledger operation failed: {}", error);
        } else {
            log.warn("Ledger operation refused: {}", error);
        }
        return ResponseEntity.status(status).body(toApiError(statusLabel(error.getKind()), error));
    }

    @ExceptionHandler(ImportRejectedException.class)
    public ResponseEntity<ApiError> handleImportRejected(ImportRejectedException e) {
        log.warn("Import rejected: {}", e.getError());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(toApiError("Import Rejected", e.getError()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .kind(ErrorKind.VALIDATION)
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error("Malformed Request")
            .kind(ErrorKind.VALIDATION)
            .message("Request body is not valid JSON for this endpoint")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .kind(ErrorKind.VALIDATION)
            .field(e.getName())
            .message("Invalid value for " + e.getName() + ": " + e.getValue())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Upload too large: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Payload Too Large")
            .kind(ErrorKind.VALIDATION)
            .field("file")
            .message("Attachment exceeds the upload limit")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
            case REFERENTIAL:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INTERNAL_CONSISTENCY:
            case STORAGE:
                return HttpStatus.INTERNAL_SERVER_ERROR;
            default:
                throw new IllegalStateException("Unhandled error kind: " + kind);
        }
    }

    private static String statusLabel(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                return "Validation Failed";
            case REFERENTIAL:
                return "Invalid Reference";
            case NOT_FOUND:
                return "Not Found";
            case INTERNAL_CONSISTENCY:
                return "Internal Consistency Error";
            case STORAGE:
                return "Storage Error";
            default:
                throw new IllegalStateException("Unhandled error kind: " + kind);
        }
    }

    private static ApiError toApiError(String label, LedgerError error) {
        return ApiError.builder()
            .error(label)
            .kind(error.getKind())
            .field(error.getField())
            .message(error.getMessage())
            .details(error.getContext().isEmpty() ? null : error.getContext())
            .timestamp(Instant.now())
            .build();
    }
}
