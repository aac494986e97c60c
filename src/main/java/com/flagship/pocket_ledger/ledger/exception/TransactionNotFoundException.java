package com.flagship.pocket_ledger.ledger.exception;

public class TransactionNotFoundException extends NotFoundException {

    public TransactionNotFoundException(String transactionId) {
        super("Transaction", transactionId);
    }
}
