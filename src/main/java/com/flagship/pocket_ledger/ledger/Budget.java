package com.flagship.pocket_ledger.ledger;

import com.flagship.pocket_ledger.amount.FixedAmount;
import lombok.Value;

import java.time.Instant;

/**
 * Spending target for a tag over the half-open window [start, end).
 * The actual spend is always derived from lines on read.
 */
@Value
public class Budget {
    String id;
    long tagId;
    Instant start;
    Instant end;
    FixedAmount target;

    public boolean covers(Instant timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }
}
