package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.flagship.pocket_ledger.amount.FixedAmount;
import com.flagship.pocket_ledger.builder.ExchangeIntent;
import com.flagship.pocket_ledger.builder.ExpenseIntent;
import com.flagship.pocket_ledger.builder.IncomeIntent;
import com.flagship.pocket_ledger.builder.TransactionIntent;
import com.flagship.pocket_ledger.builder.TransferIntent;

import java.math.BigDecimal;

/**
 * Request body for recording or editing a transaction. The {@code type} property selects
 * the intent shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = IncomeRequest.class, name = "income"),
    @JsonSubTypes.Type(value = ExpenseRequest.class, name = "expense"),
    @JsonSubTypes.Type(value = TransferRequest.class, name = "transfer"),
    @JsonSubTypes.Type(value = ExchangeRequest.class, name = "exchange")
})
public interface TransactionRequest {

    TransactionIntent toIntent();

    /**
     * Maps a decomposed intent back to its request shape, for read responses.
     * Read-only entries have no intent and map to null.
     */
    static TransactionRequest fromIntent(TransactionIntent intent) {
        if (intent instanceof IncomeIntent income) {
            return IncomeRequest.from(income);
        } else if (intent instanceof ExpenseIntent expense) {
            return ExpenseRequest.from(expense);
        } else if (intent instanceof TransferIntent transfer) {
            return TransferRequest.from(transfer);
        } else if (intent instanceof ExchangeIntent exchange) {
            return ExchangeRequest.from(exchange);
        }
        return null;
    }

    static FixedAmount toFixed(BigDecimal value) {
        return value == null ? null : FixedAmount.of(value);
    }

    static BigDecimal toDecimal(FixedAmount value) {
        return value == null ? null : value.toBigDecimal();
    }
}
