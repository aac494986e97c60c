package com.flagship.pocket_ledger.query;

import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.amount.Sign;
import com.flagship.pocket_ledger.config.LedgerProperties;
import com.flagship.pocket_ledger.ledger.Account;
import com.flagship.pocket_ledger.ledger.Budget;
import com.flagship.pocket_ledger.ledger.DatedLine;
import com.flagship.pocket_ledger.ledger.Line;
import com.flagship.pocket_ledger.ledger.SystemTag;
import com.flagship.pocket_ledger.ledger.Tag;
import com.flagship.pocket_ledger.ledger.exception.NotFoundException;
import com.flagship.pocket_ledger.store.LedgerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read-only derivations over the line set: month and day totals, running balances,
 * rollups and budget progress.
 *
 * Nothing is cached; every figure is recomputed from lines on each call. Amounts in
 * summaries are converted to the reference currency with each line's own rate snapshot.
 *
 * A line counts as income when it is {@code +} and not an add-on, as expense when it
 * is {@code -}; a {@code +} add-on (discount) reduces expense. Lines that only move money
 * between own accounts (TRANSFER, EXCHANGE) and system balance entries (INITIAL,
 * ADJUSTMENT) are left out. Fees count as expense.
 */
@Service
@RequiredArgsConstructor
public class AggregationService {

    static final Instant END_OF_TIME = Instant.parse("9999-12-31T00:00:00Z");

    private final LedgerStore store;
    private final LedgerProperties properties;

    @Transactional(readOnly = true)
    public MonthSummary monthSummary(YearMonth month) {
        ZoneId zone = properties.getZoneId();
        List<Line> lines = store.getLinesInRange(monthStart(month, zone), monthStart(month.plusMonths(1), zone))
            .stream()
            .map(DatedLine::getLine)
            .toList();
        return new MonthSummary(month, income(lines), expense(lines));
    }

    /**
     * Totals for every day of the month, in date order; days without lines are zero.
     */
    @Transactional(readOnly = true)
    public List<DailyNet> dailyNet(YearMonth month) {
        ZoneId zone = properties.getZoneId();
        Map<LocalDate, List<Line>> byDay = groupByDay(
            store.getLinesInRange(monthStart(month, zone), monthStart(month.plusMonths(1), zone)), zone);

        List<DailyNet> days = new ArrayList<>();
        for (LocalDate day = month.atDay(1); !day.isAfter(month.atEndOfMonth()); day = day.plusDays(1)) {
            List<Line> lines = byDay.getOrDefault(day, List.of());
            days.add(new DailyNet(day, income(lines), expense(lines)));
        }
        return days;
    }

    /**
     * End-of-day balances of one account over a month, in the account currency.
     *
     * Walks backward from the end-of-month balance, which is the current balance less
     * everything booked after the month: each day records the running balance and then
     * subtracts that day's net.
     */
    @Transactional(readOnly = true)
    public List<DailyBalance> runningBalances(long accountId, YearMonth month) {
        Account account = store.getAccount(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
        ZoneId zone = properties.getZoneId();
        Instant monthEnd = monthStart(month.plusMonths(1), zone);

        FixedAmount running = account.getBalance()
            .subtract(signedSum(store.getLinesForAccountInRange(accountId, monthEnd, END_OF_TIME).stream()
                .map(DatedLine::getLine)
                .toList()));
        Map<LocalDate, List<Line>> byDay = groupByDay(
            store.getLinesForAccountInRange(accountId, monthStart(month, zone), monthEnd), zone);

        List<DailyBalance> balances = new ArrayList<>();
        for (LocalDate day = month.atEndOfMonth(); !day.isBefore(month.atDay(1)); day = day.minusDays(1)) {
            balances.add(new DailyBalance(day, running));
            running = running.subtract(signedSum(byDay.getOrDefault(day, List.of())));
        }
        Collections.reverse(balances);
        return balances;
    }

    @Transactional(readOnly = true)
    public List<Rollup> tagRollups(Instant from, Instant to) {
        return rollup(store.getLinesInRange(from, to), datedLine -> datedLine.getLine().getTagId());
    }

    /**
     * Rollups by counterparty; transactions without one are left out.
     */
    @Transactional(readOnly = true)
    public List<Rollup> counterpartyRollups(Instant from, Instant to) {
        List<DatedLine> withCounterparty = store.getLinesInRange(from, to).stream()
            .filter(datedLine -> datedLine.getCounterpartyId() != null)
            .toList();
        return rollup(withCounterparty, DatedLine::getCounterpartyId);
    }

    /**
     * Spend under the budget's tag and every tag below it inside {@code [start, end)}.
     * Refunds and discounts under those tags reduce the actual.
     */
    @Transactional(readOnly = true)
    public BudgetProgress budgetProgress(String budgetId) {
        Budget budget = store.getBudget(budgetId)
            .orElseThrow(() -> new NotFoundException("Budget", budgetId));
        Map<Long, Tag> tags = store.getTags().stream()
            .collect(Collectors.toMap(Tag::getId, Function.identity()));
        Predicate<Line> underBudgetTag = line -> line.getTagId() == budget.getTagId()
            || (tags.containsKey(line.getTagId())
                && tags.get(line.getTagId()).hasAncestor(budget.getTagId(), tags::get));

        FixedAmount actual = FixedAmount.ZERO;
        for (DatedLine datedLine : store.getLinesInRange(budget.getStart(), budget.getEnd())) {
            Line line = datedLine.getLine();
            if (isFlow(line) && underBudgetTag.test(line)) {
                actual = actual.subtract(line.signedReferenceAmount());
            }
        }

        BigDecimal ratio = budget.getTarget().isZero()
            ? null
            : actual.toBigDecimal().divide(budget.getTarget().toBigDecimal(), MathContext.DECIMAL64);
        return new BudgetProgress(budget, actual, budget.getTarget().subtract(actual), ratio);
    }

    static FixedAmount income(Collection<Line> lines) {
        FixedAmount total = FixedAmount.ZERO;
        for (Line line : lines) {
            if (isFlow(line) && line.getSign() == Sign.PLUS && !line.isCommon()) {
                total = total.add(referenceAmount(line, Sign.PLUS));
            }
        }
        return total;
    }

    static FixedAmount expense(Collection<Line> lines) {
        FixedAmount total = FixedAmount.ZERO;
        for (Line line : lines) {
            if (!isFlow(line)) {
                continue;
            }
            if (line.getSign() == Sign.MINUS) {
                total = total.add(referenceAmount(line, Sign.PLUS));
            } else if (line.isCommon()) {
                total = total.subtract(referenceAmount(line, Sign.PLUS));
            }
        }
        return total;
    }

    private List<Rollup> rollup(List<DatedLine> datedLines, Function<DatedLine, Long> key) {
        Map<Long, List<Line>> grouped = new TreeMap<>();
        for (DatedLine datedLine : datedLines) {
            grouped.computeIfAbsent(key.apply(datedLine), id -> new ArrayList<>()).add(datedLine.getLine());
        }

        List<Rollup> rollups = new ArrayList<>();
        grouped.forEach((id, lines) -> {
            if (lines.stream().anyMatch(AggregationService::isFlow)) {
                rollups.add(new Rollup(id, income(lines), expense(lines)));
            }
        });
        return rollups;
    }

    private static boolean isFlow(Line line) {
        return SystemTag.fromId(line.getTagId())
            .map(tag -> !tag.isMovement() && !tag.isReadOnlyMarker())
            .orElse(true);
    }

    private static FixedAmount referenceAmount(Line line, Sign sign) {
        return sign.apply(line.getAmount().multiply(line.getRate()));
    }

    private static FixedAmount signedSum(Collection<Line> lines) {
        FixedAmount total = FixedAmount.ZERO;
        for (Line line : lines) {
            total = total.add(line.signedAmount());
        }
        return total;
    }

    private static Map<LocalDate, List<Line>> groupByDay(List<DatedLine> datedLines, ZoneId zone) {
        Map<LocalDate, List<Line>> byDay = new TreeMap<>();
        for (DatedLine datedLine : datedLines) {
            LocalDate day = datedLine.getTimestamp().atZone(zone).toLocalDate();
            byDay.computeIfAbsent(day, date -> new ArrayList<>()).add(datedLine.getLine());
        }
        return byDay;
    }

    private static Instant monthStart(YearMonth month, ZoneId zone) {
        return month.atDay(1).atStartOfDay(zone).toInstant();
    }
}
