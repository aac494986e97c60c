package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.builder.ExchangeIntent;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange between accounts of different currencies; both amounts are what actually moved.
 */
@Value
@Builder
@Jacksonized
public class ExchangeRequest implements TransactionRequest {

    @NotNull(message = "Source account is required")
    @JsonProperty("from_account_id")
    Long fromAccountId;

    @NotNull(message = "Destination account is required")
    @JsonProperty("to_account_id")
    Long toAccountId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Destination amount is required")
    @JsonProperty("to_amount")
    BigDecimal toAmount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("note")
    String note;

    @JsonProperty("counterparty_id")
    Long counterpartyId;

    @Override
    public ExchangeIntent toIntent() {
        return ExchangeIntent.builder()
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(TransactionRequest.toFixed(amount))
            .toAmount(TransactionRequest.toFixed(toAmount))
            .fee(TransactionRequest.toFixed(fee))
            .timestamp(timestamp)
            .note(note)
            .counterpartyId(counterpartyId)
            .build();
    }

    public static ExchangeRequest from(ExchangeIntent intent) {
        return ExchangeRequest.builder()
            .fromAccountId(intent.getFromAccountId())
            .toAccountId(intent.getToAccountId())
            .amount(TransactionRequest.toDecimal(intent.getAmount()))
            .toAmount(TransactionRequest.toDecimal(intent.getToAmount()))
            .fee(TransactionRequest.toDecimal(intent.getFee()))
            .timestamp(intent.getTimestamp())
            .note(intent.getNote())
            .counterpartyId(intent.getCounterpartyId())
            .build();
    }
}
