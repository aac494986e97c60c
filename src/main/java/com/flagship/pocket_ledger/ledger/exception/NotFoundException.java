package com.flagship.pocket_ledger.ledger.exception;

/**
 * A referenced ledger record does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String kind, Object id) {
        super(kind + " not found: " + id);
    }
}
