package com.flagship.pocket_ledger.classifier;

import lombok.Value;

/**
 * Result of classifying a line set.
 * {@code multiCurrency} is set for expenses paid from an account in another currency;
 * {@code fallback} is set when the line set did not look like anything the builder
 * produces and the sign rule decided.
 */
@Value
public class Classification {
    TransactionMode mode;
    boolean multiCurrency;
    boolean fallback;

    public static Classification of(TransactionMode mode) {
        return new Classification(mode, false, false);
    }

    public boolean isReadOnly() {
        return mode.isReadOnly();
    }
}
