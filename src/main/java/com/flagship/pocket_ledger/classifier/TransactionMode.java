package com.flagship.pocket_ledger.classifier;

/**
 * Derived type of a transaction. Never stored; always recomputed from the lines.
 */
public enum TransactionMode {
    INITIAL_BALANCE(true),
    ADJUSTMENT(true),
    EXPENSE(false),
    EXCHANGE(false),
    TRANSFER(false),
    INCOME(false);

    private final boolean readOnly;

    TransactionMode(boolean readOnly) {
        this.readOnly = readOnly;
    }

    public boolean isReadOnly() {
        return readOnly;
    }
}
