package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.account.AccountType;
import com.flagship.bookkeeping.report.Granularity;
import com.flagship.bookkeeping.report.JournalRow;
import com.flagship.bookkeeping.report.ReportingService;
import com.flagship.bookkeeping.result.LedgerError;
import com.flagship.bookkeeping.setting.SettingsService;
import com.flagship.bookkeeping.web.dto.AssetsTrendPointResponse;
import com.flagship.bookkeeping.web.dto.BalanceSheetRowResponse;
import com.flagship.bookkeeping.web.dto.ExpenseTrendPointResponse;
import com.flagship.bookkeeping.web.dto.JournalRowResponse;
import com.flagship.bookkeeping.web.dto.TrendResponse;
import com.flagship.bookkeeping.web.exception.LedgerOperationException;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only report endpoints. Amount texts use the domestic currency setting.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportingService reportingService;
    private final SettingsService settingsService;

    @GetMapping("/journal")
    public List<JournalRowResponse> journal(@RequestParam(name = "account_code", required = false) String accountCode,
                                            @RequestParam(name = "account_type", required = false) AccountType accountType) {
        return toJournalResponses(reportingService.listJournal(accountCode, accountType));
    }

    @GetMapping("/expenses")
    public List<JournalRowResponse> expenses() {
        return toJournalResponses(reportingService.listExpenseList());
    }

    @GetMapping("/balance-sheet")
    public List<BalanceSheetRowResponse> balanceSheet() {
        String currency = settingsService.getDomesticCurrency();
        return reportingService.getBalanceSheet().stream()
            .map(row -> BalanceSheetRowResponse.from(row, currency))
            .collect(Collectors.toList());
    }

    @GetMapping("/expense-trend")
    public TrendResponse<ExpenseTrendPointResponse> expenseTrend(
            @RequestParam(name = "granularity", required = false) String granularity,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        checkRange(from, to);
        Granularity resolved = resolveGranularity(granularity, from, to);
        List<ExpenseTrendPointResponse> points = reportingService.listExpenseTrend(resolved, from, to).stream()
            .map(ExpenseTrendPointResponse::from)
            .collect(Collectors.toList());
        return new TrendResponse<>(resolved, from, to, points);
    }

    @GetMapping("/assets-trend")
    public TrendResponse<AssetsTrendPointResponse> assetsTrend(
            @RequestParam(name = "granularity", required = false) String granularity,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        checkRange(from, to);
        Granularity resolved = resolveGranularity(granularity, from, to);
        List<AssetsTrendPointResponse> points = reportingService.listAssetsTrend(resolved, from, to).stream()
            .map(AssetsTrendPointResponse::from)
            .collect(Collectors.toList());
        return new TrendResponse<>(resolved, from, to, points);
    }

    private List<JournalRowResponse> toJournalResponses(List<JournalRow> rows) {
        String currency = settingsService.getDomesticCurrency();
        return rows.stream()
            .map(row -> JournalRowResponse.from(row, currency))
            .collect(Collectors.toList());
    }

    private static Granularity resolveGranularity(String value, LocalDate from, LocalDate to) {
        return Granularity.parse(value, from, to)
            .orElseThrow(() -> new LedgerOperationException(
                LedgerError.validation("granularity", "granularity must be day, month or auto: " + value)));
    }

    private static void checkRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new LedgerOperationException(
                LedgerError.validation("from", "from must not be after to"));
        }
    }
}
