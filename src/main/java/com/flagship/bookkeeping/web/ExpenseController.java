package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.expense.ExpenseEntryComposer;
import com.flagship.bookkeeping.expense.ExpenseEntryView;
import com.flagship.bookkeeping.web.dto.ExpenseRequest;
import com.flagship.bookkeeping.web.dto.ExpenseViewResponse;
import com.flagship.bookkeeping.web.exception.LedgerOperationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for the manual expense form.
 */
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final ExpenseEntryComposer expenseComposer;

    @PostMapping
    public ResponseEntity<ExpenseViewResponse> createExpense(@Valid @RequestBody ExpenseRequest request) {
        UUID entryUuid = LedgerOperationException.valueOrThrow(expenseComposer.saveExpense(request.toForm(), null));
        log.info("Expense entry created: entryUuid={}", entryUuid);
        return ResponseEntity.status(HttpStatus.CREATED).body(load(entryUuid));
    }

    @PutMapping("/{id}")
    public ExpenseViewResponse replaceExpense(@PathVariable("id") UUID id, @Valid @RequestBody ExpenseRequest request) {
        LedgerOperationException.valueOrThrow(expenseComposer.saveExpense(request.toForm(), id));
        return load(id);
    }

    @GetMapping("/{id}")
    public ExpenseViewResponse getExpense(@PathVariable("id") UUID id) {
        return load(id);
    }

    private ExpenseViewResponse load(UUID entryUuid) {
        ExpenseEntryView view = LedgerOperationException.valueOrThrow(expenseComposer.loadExpense(entryUuid));
        return ExpenseViewResponse.from(view);
    }
}
