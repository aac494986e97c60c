package com.flagship.pocket_ledger.ledger.exception;

/**
 * Initial-balance and adjustment entries belong to the system and cannot be edited or deleted.
 */
public class ReadOnlyTransactionException extends IllegalStateException {

    public ReadOnlyTransactionException(String transactionId, String mode) {
        super("Transaction " + transactionId + " is a read-only " + mode + " entry");
    }
}
