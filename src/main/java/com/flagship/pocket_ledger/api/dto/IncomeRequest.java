package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.builder.IncomeIntent;
import com.flagship.pocket_ledger.builder.NewCategory;
import com.flagship.pocket_ledger.ledger.CategoryType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Income into one account. Either {@code tag_id} or {@code new_category_name} with
 * {@code new_category_type} names the category.
 */
@Value
@Builder
@Jacksonized
public class IncomeRequest implements TransactionRequest {

    @NotNull(message = "Account is required")
    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("tag_id")
    Long tagId;

    @Size(max = 255, message = "Category name is too long")
    @JsonProperty("new_category_name")
    String newCategoryName;

    @JsonProperty("new_category_type")
    CategoryType newCategoryType;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("note")
    String note;

    @JsonProperty("counterparty_id")
    Long counterpartyId;

    @Override
    public IncomeIntent toIntent() {
        NewCategory newCategory = newCategoryName == null ? null : new NewCategory(newCategoryName, newCategoryType);
        return IncomeIntent.builder()
            .accountId(accountId)
            .tagId(tagId)
            .newCategory(newCategory)
            .amount(TransactionRequest.toFixed(amount))
            .timestamp(timestamp)
            .note(note)
            .counterpartyId(counterpartyId)
            .build();
    }

    public static IncomeRequest from(IncomeIntent intent) {
        return IncomeRequest.builder()
            .accountId(intent.getAccountId())
            .tagId(intent.getTagId())
            .amount(TransactionRequest.toDecimal(intent.getAmount()))
            .timestamp(intent.getTimestamp())
            .note(intent.getNote())
            .counterpartyId(intent.getCounterpartyId())
            .build();
    }
}
