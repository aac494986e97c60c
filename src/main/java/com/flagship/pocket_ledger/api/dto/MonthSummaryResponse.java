package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.query.DailyNet;
import com.flagship.pocket_ledger.query.MonthSummary;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class MonthSummaryResponse {

    @JsonProperty("month")
    String month;

    @JsonProperty("income")
    BigDecimal income;

    @JsonProperty("expense")
    BigDecimal expense;

    @JsonProperty("net")
    BigDecimal net;

    @JsonProperty("days")
    List<Day> days;

    public static MonthSummaryResponse from(MonthSummary summary, List<DailyNet> days) {
        return MonthSummaryResponse.builder()
            .month(summary.getMonth().toString())
            .income(summary.getIncome().toBigDecimal())
            .expense(summary.getExpense().toBigDecimal())
            .net(summary.getNet().toBigDecimal())
            .days(days.stream()
                .map(day -> new Day(day.getDate(), day.getIncome().toBigDecimal(),
                    day.getExpense().toBigDecimal(), day.getNet().toBigDecimal()))
                .toList())
            .build();
    }

    @Value
    public static class Day {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("income")
        BigDecimal income;

        @JsonProperty("expense")
        BigDecimal expense;

        @JsonProperty("net")
        BigDecimal net;
    }
}
