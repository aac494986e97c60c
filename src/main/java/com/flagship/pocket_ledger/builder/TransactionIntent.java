package com.flagship.pocket_ledger.builder;

import java.time.Instant;
import java.util.Set;

/**
 * What the user means to record. The builder expands an intent into lines and the
 * classifier turns lines back into the intent.
 */
public interface TransactionIntent {

    Instant getTimestamp();

    String getNote();

    Long getCounterpartyId();

    /**
     * Accounts that must be loaded before the intent can be built.
     */
    Set<Long> referencedAccountIds();

    TransactionIntent withTimestamp(Instant timestamp);
}
