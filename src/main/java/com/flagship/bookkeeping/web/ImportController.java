package com.flagship.bookkeeping.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.bookkeeping.importer.ExpenseImportResult;
import com.flagship.bookkeeping.importer.ExpenseImportService;
import com.flagship.bookkeeping.result.LedgerResult;
import com.flagship.bookkeeping.web.dto.ImportResponse;
import com.flagship.bookkeeping.web.exception.ImportRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts one expense import document per request.
 */
@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
@Slf4j
public class ImportController {

    private final ExpenseImportService importService;

    @PostMapping("/expense")
    public ResponseEntity<ImportResponse> importExpense(@RequestBody JsonNode payload) {
        LedgerResult<ExpenseImportResult> result = importService.importPayload(payload);
        if (result.isFailure()) {
            throw new ImportRejectedException(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(ImportResponse.from(result.getValue()));
    }
}
