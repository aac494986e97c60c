package com.flagship.pocket_ledger.api;

import com.flagship.pocket_ledger.api.dto.BudgetProgressResponse;
import com.flagship.pocket_ledger.api.dto.MonthSummaryResponse;
import com.flagship.pocket_ledger.api.dto.RollupResponse;
import com.flagship.pocket_ledger.api.dto.RunningBalanceResponse;
import com.flagship.pocket_ledger.config.LedgerProperties;
import com.flagship.pocket_ledger.ledger.exception.ValidationException;
import com.flagship.pocket_ledger.query.AggregationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Read-only summaries derived from the ledger lines. Months are {@code YYYY-MM} in the
 * configured ledger zone.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SummaryController {

    private final AggregationService aggregationService;
    private final LedgerProperties properties;

    @GetMapping("/summaries/month")
    public ResponseEntity<MonthSummaryResponse> monthSummary(@RequestParam String month) {
        YearMonth yearMonth = parseMonth(month);
        return ResponseEntity.ok(MonthSummaryResponse.from(
            aggregationService.monthSummary(yearMonth),
            aggregationService.dailyNet(yearMonth)));
    }

    @GetMapping("/summaries/tags")
    public ResponseEntity<List<RollupResponse>> tagRollups(@RequestParam String month) {
        YearMonth yearMonth = parseMonth(month);
        return ResponseEntity.ok(aggregationService.tagRollups(start(yearMonth), start(yearMonth.plusMonths(1)))
            .stream()
            .map(RollupResponse::from)
            .toList());
    }

    @GetMapping("/summaries/counterparties")
    public ResponseEntity<List<RollupResponse>> counterpartyRollups(@RequestParam String month) {
        YearMonth yearMonth = parseMonth(month);
        return ResponseEntity.ok(aggregationService.counterpartyRollups(start(yearMonth), start(yearMonth.plusMonths(1)))
            .stream()
            .map(RollupResponse::from)
            .toList());
    }

    @GetMapping("/accounts/{id}/running-balance")
    public ResponseEntity<RunningBalanceResponse> runningBalance(@PathVariable long id, @RequestParam String month) {
        YearMonth yearMonth = parseMonth(month);
        return ResponseEntity.ok(RunningBalanceResponse.from(id, yearMonth.toString(),
            aggregationService.runningBalances(id, yearMonth)));
    }

    @GetMapping("/budgets/{id}/progress")
    public ResponseEntity<BudgetProgressResponse> budgetProgress(@PathVariable String id) {
        return ResponseEntity.ok(BudgetProgressResponse.from(aggregationService.budgetProgress(id)));
    }

    private Instant start(YearMonth month) {
        ZoneId zone = properties.getZoneId();
        return month.atDay(1).atStartOfDay(zone).toInstant();
    }

    private static YearMonth parseMonth(String month) {
        try {
            return YearMonth.parse(month);
        } catch (DateTimeParseException e) {
            throw new ValidationException("month", "Expected YYYY-MM, got " + month);
        }
    }
}
