package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.query.BudgetProgress;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BudgetProgressResponse {

    @JsonProperty("budget_id")
    String budgetId;

    @JsonProperty("tag_id")
    long tagId;

    @JsonProperty("start")
    Instant start;

    @JsonProperty("end")
    Instant end;

    @JsonProperty("target")
    BigDecimal target;

    @JsonProperty("actual")
    BigDecimal actual;

    @JsonProperty("remaining")
    BigDecimal remaining;

    @JsonProperty("ratio")
    BigDecimal ratio;

    public static BudgetProgressResponse from(BudgetProgress progress) {
        return BudgetProgressResponse.builder()
            .budgetId(progress.getBudget().getId())
            .tagId(progress.getBudget().getTagId())
            .start(progress.getBudget().getStart())
            .end(progress.getBudget().getEnd())
            .target(progress.getBudget().getTarget().toBigDecimal())
            .actual(progress.getActual().toBigDecimal())
            .remaining(progress.getRemaining().toBigDecimal())
            .ratio(progress.getRatio())
            .build();
    }
}
