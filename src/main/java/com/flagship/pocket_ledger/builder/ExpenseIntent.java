package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A purchase paid from one account, split across one or more categories, with
 * optional add-ons.
 *
 * When {@code categoryCurrencyId} differs from the paying account's currency the
 * purchase is priced in that currency and {@code paidAmount} is what left the paying
 * account in its own currency.
 */
@Value
@Builder(toBuilder = true)
public class ExpenseIntent implements TransactionIntent {
    Long accountId;
    @Builder.Default
    List<CategoryEntry> entries = List.of();
    @Builder.Default
    List<AddOn> addOns = List.of();
    Long categoryCurrencyId;
    FixedAmount paidAmount;
    Instant timestamp;
    String note;
    Long counterpartyId;

    public FixedAmount baseAmount() {
        FixedAmount base = FixedAmount.ZERO;
        for (CategoryEntry entry : entries) {
            if (entry.getAmount() != null) {
                base = base.add(entry.getAmount());
            }
        }
        return base;
    }

    public boolean isMixedCurrency(long accountCurrencyId) {
        return categoryCurrencyId != null && categoryCurrencyId != accountCurrencyId;
    }

    @Override
    public Set<Long> referencedAccountIds() {
        return accountId == null ? Set.of() : Set.of(accountId);
    }

    @Override
    public ExpenseIntent withTimestamp(Instant timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }
}
