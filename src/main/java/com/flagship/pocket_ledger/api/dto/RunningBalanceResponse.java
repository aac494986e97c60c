package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.query.DailyBalance;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class RunningBalanceResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("month")
    String month;

    @JsonProperty("balances")
    List<Day> balances;

    public static RunningBalanceResponse from(long accountId, String month, List<DailyBalance> balances) {
        return new RunningBalanceResponse(accountId, month, balances.stream()
            .map(balance -> new Day(balance.getDate(), balance.getBalance().toBigDecimal()))
            .toList());
    }

    @Value
    public static class Day {

        @JsonProperty("date")
        LocalDate date;

        @JsonProperty("balance")
        BigDecimal balance;
    }
}
