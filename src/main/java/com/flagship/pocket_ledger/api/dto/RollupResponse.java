package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.query.Rollup;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class RollupResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("income")
    BigDecimal income;

    @JsonProperty("expense")
    BigDecimal expense;

    @JsonProperty("net")
    BigDecimal net;

    public static RollupResponse from(Rollup rollup) {
        return new RollupResponse(rollup.getKey(), rollup.getIncome().toBigDecimal(),
            rollup.getExpense().toBigDecimal(), rollup.getNet().toBigDecimal());
    }
}
