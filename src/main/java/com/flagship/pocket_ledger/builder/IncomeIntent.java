package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Money received into one account under one category.
 * {@code newCategory} is resolved into {@code tagId} by the caller before building.
 */
@Value
@Builder(toBuilder = true)
public class IncomeIntent implements TransactionIntent {
    Long accountId;
    Long tagId;
    NewCategory newCategory;
    FixedAmount amount;
    Instant timestamp;
    String note;
    Long counterpartyId;

    public IncomeIntent withCategory(long createdTagId) {
        return toBuilder().tagId(createdTagId).newCategory(null).build();
    }

    @Override
    public Set<Long> referencedAccountIds() {
        return accountId == null ? Set.of() : Set.of(accountId);
    }

    @Override
    public IncomeIntent withTimestamp(Instant timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }
}
