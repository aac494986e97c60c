package com.flagship.pocket_ledger.builder;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Same-currency move between two accounts, optionally with a fee charged on the source.
 */
@Value
@Builder(toBuilder = true)
public class TransferIntent implements TransactionIntent {
    Long fromAccountId;
    Long toAccountId;
    FixedAmount amount;
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
    public TransferIntent withTimestamp(Instant timestamp) {
        return toBuilder().timestamp(timestamp).build();
    }
}
