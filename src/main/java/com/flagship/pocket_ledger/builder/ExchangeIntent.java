package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Currency exchange between two accounts. Both sides carry their own amount; the
 * conversion does not have to follow the cached rate.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeIntent implements TransactionIntent {
    Long fromAccountId;
    Long toAccountId;
    FixedAmount amount;
    FixedAmount toAmount;
    FixedAmount fee;
    Instant timestamp;
    String note;
    Long counterpartyId;

    @Override
    public Set<Long> referencedAccountIds() {
        Set<Long> ids = new HashSet<>();
        if (fromAccountId != null) {
            ids.add(fromAccountId);
        }
        if (toAccountId != null) {
            ids.add(toAccountId);
        }
        return ids;
    }

    @Override
    public ExchangeIntent withTimestamp(Instant timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }
}
