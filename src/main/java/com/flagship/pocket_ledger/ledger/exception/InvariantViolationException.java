package com.flagship.pocket_ledger.ledger.exception;

/**
 * A balance delta and a line mutation got out of step. This is a programming error
 * and must never be caught and ignored.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
