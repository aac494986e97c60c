package com.flagship.pocket_ledger.ledger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An intent failed a precondition. Field-level and recoverable: nothing has been applied.
 */
public class ValidationException extends IllegalArgumentException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put(field, message);
        this.fieldErrors = Collections.unmodifiableMap(errors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public String getField() {
        return fieldErrors.keySet().iterator().next();
    }
}
