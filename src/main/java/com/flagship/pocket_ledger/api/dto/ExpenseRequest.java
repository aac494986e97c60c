package com.flagship.pocket_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pocket_ledger.builder.AddOn;
import com.flagship.pocket_ledger.builder.CategoryEntry;
import com.flagship.pocket_ledger.builder.ExpenseIntent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Expense split across categories, with optional add-ons (tip, VAT, fee, discount).
 * Set {@code category_currency_id} and {@code paid_amount} when the purchase is priced in
 * another currency than the paying account's.
 */
@Value
@Builder
@Jacksonized
public class ExpenseRequest implements TransactionRequest {

    @NotNull(message = "Account is required")
    @JsonProperty("account_id")
    Long accountId;

    @NotEmpty(message = "At least one category is required")
    @Valid
    @JsonProperty("entries")
    List<Entry> entries;

    @Valid
    @JsonProperty("add_ons")
    List<AddOnRequest> addOns;

    @JsonProperty("category_currency_id")
    Long categoryCurrencyId;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("note")
    String note;

    @JsonProperty("counterparty_id")
    Long counterpartyId;

    @Override
    public ExpenseIntent toIntent() {
        List<CategoryEntry> categoryEntries = entries == null ? List.of() : entries.stream()
            .map(entry -> new CategoryEntry(entry.getTagId(), TransactionRequest.toFixed(entry.getAmount())))
            .toList();
        List<AddOn> intentAddOns = addOns == null ? List.of() : addOns.stream()
            .map(addOn -> new AddOn(addOn.getTagId(), TransactionRequest.toFixed(addOn.getAmount()),
                addOn.getPercentage()))
            .toList();
        return ExpenseIntent.builder()
            .accountId(accountId)
            .entries(categoryEntries)
            .addOns(intentAddOns)
            .categoryCurrencyId(categoryCurrencyId)
            .paidAmount(TransactionRequest.toFixed(paidAmount))
            .timestamp(timestamp)
            .note(note)
            .counterpartyId(counterpartyId)
            .build();
    }

    public static ExpenseRequest from(ExpenseIntent intent) {
        return ExpenseRequest.builder()
            .accountId(intent.getAccountId())
            .entries(intent.getEntries().stream()
                .map(entry -> new Entry(entry.getTagId(), TransactionRequest.toDecimal(entry.getAmount())))
                .toList())
            .addOns(intent.getAddOns().stream()
                .map(addOn -> new AddOnRequest(addOn.getTagId(), TransactionRequest.toDecimal(addOn.getAmount()),
                    addOn.getPercentage()))
                .toList())
            .categoryCurrencyId(intent.getCategoryCurrencyId())
            .paidAmount(TransactionRequest.toDecimal(intent.getPaidAmount()))
            .timestamp(intent.getTimestamp())
            .note(intent.getNote())
            .counterpartyId(intent.getCounterpartyId())
            .build();
    }

    @Value
    public static class Entry {

        @NotNull(message = "Category is required")
        @JsonProperty("tag_id")
        Long tagId;

        @NotNull(message = "Amount is required")
        @JsonProperty("amount")
        BigDecimal amount;
    }

    /**
     * Either {@code amount} or {@code percentage} (0.15 for 15%); neither clears the add-on.
     */
    @Value
    public static class AddOnRequest {

        @NotNull(message = "Add-on tag is required")
        @JsonProperty("tag_id")
        Long tagId;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("percentage")
        BigDecimal percentage;
    }
}
