package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.ledger.Line;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LineResponse {

    @JsonProperty("account_id")
    long accountId;

    @JsonProperty("tag_id")
    long tagId;

    @JsonProperty("sign")
    String sign;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("rate")
    BigDecimal rate;

    @JsonProperty("pct_value")
    BigDecimal pctValue;

    @JsonProperty("common")
    boolean common;

    public static LineResponse from(Line line) {
        return LineResponse.builder()
            .accountId(line.getAccountId())
            .tagId(line.getTagId())
            .sign(String.valueOf(line.getSign().symbol()))
            .amount(line.getAmount().toBigDecimal())
            .rate(line.getRate().toBigDecimal())
            .pctValue(line.getPctValue())
            .common(line.isCommon())
            .build();
    }
}
