package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.account.Account;
import com.flagship.bookkeeping.account.AccountFilter;
import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.account.ChartOfAccountsService;
import com.flagship.bookkeeping.web.dto.AccountResponse;
import com.flagship.bookkeeping.web.dto.CreateAccountRequest;
import com.flagship.bookkeeping.web.dto.UpdateAccountRequest;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST controller for the chart of accounts.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final ChartOfAccountsService chartOfAccounts;

    /**
     * Lists accounts by code. {@code active} absent means any; {@code type} may repeat.
     */
    @GetMapping
    public List<AccountResponse> listAccounts(@RequestParam(name = "active", required = false) Boolean active,
                                              @RequestParam(name = "type", required = false) List<AccountType> types) {
        Set<AccountType> typeSet = types == null || types.isEmpty()
            ? EnumSet.noneOf(AccountType.class)
            : EnumSet.copyOf(types);
        return toResponses(chartOfAccounts.listAccounts(new AccountFilter(active, typeSet)));
    }

    @GetMapping("/expense-categories")
    public List<AccountResponse> listExpenseCategories() {
        return toResponses(chartOfAccounts.listExpenseCategories());
    }

    @GetMapping("/payment-accounts")
    public List<AccountResponse> listPaymentAccounts() {
        return toResponses(chartOfAccounts.listPaymentAccounts());
    }

    @GetMapping("/user-managed")
    public List<AccountResponse> listUserManagedAccounts() {
        return toResponses(chartOfAccounts.listUserManagedBalanceSheetAccounts());
    }

    @GetMapping("/{code}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("code") String code) {
        return chartOfAccounts.findByCode(code)
            .map(account -> ResponseEntity.ok(AccountResponse.from(account)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        boolean active = request.getActive() == null || request.getActive();
        Account created = LedgerOperationException.valueOrThrow(
            chartOfAccounts.createUserManagedAccount(request.getAccountName(), request.getAccountType(), active));
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(created));
    }

    @PutMapping("/{code}")
    public AccountResponse updateAccount(@PathVariable("code") String code,
                                         @Valid @RequestBody UpdateAccountRequest request) {
        Account updated = LedgerOperationException.valueOrThrow(
            chartOfAccounts.updateUserManagedAccount(code, request.getAccountName(), request.getActive()));
        return AccountResponse.from(updated);
    }

    private static List<AccountResponse> toResponses(List<Account> accounts) {
        return accounts.stream().map(AccountResponse::from).collect(Collectors.toList());
    }
}
