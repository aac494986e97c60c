package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.builder.TransferIntent;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
@Jacksonized
public class TransferRequest implements TransactionRequest {

    @NotNull(message = "Source account is required")
    @JsonProperty("from_account_id")
    Long fromAccountId;

    @NotNull(message = "Destination account is required")
    @JsonProperty("to_account_id")
    Long toAccountId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("note")
    String note;

    @JsonProperty("counterparty_id")
    Long counterpartyId;

    @Override
    public TransferIntent toIntent() {
        return TransferIntent.builder()
            .fromAccountId(fromAccountId)
            .toAccountId(toAccountId)
            .amount(TransactionRequest.toFixed(amount))
            .fee(TransactionRequest.toFixed(fee))
            .timestamp(timestamp)
            .note(note)
            .counterpartyId(counterpartyId)
            .build();
    }

    public static TransferRequest from(TransferIntent intent) {
        return TransferRequest.builder()
            .fromAccountId(intent.getFromAccountId())
            .toAccountId(intent.getToAccountId())
            .amount(TransactionRequest.toDecimal(intent.getAmount()))
            .fee(TransactionRequest.toDecimal(intent.getFee()))
            .timestamp(intent.getTimestamp())
            .note(intent.getNote())
            .counterpartyId(intent.getCounterpartyId())
            .build();
    }
}
