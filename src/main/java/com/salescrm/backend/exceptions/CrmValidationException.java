package com.salescrm.backend.exceptions;

import java.util.List;

/**
 * Thrown when input is rejected before any row is written. Carries every
 * message so a form can show them all at once.
 */
public class CrmValidationException extends RuntimeException {

    private final List<String> errors;

    public CrmValidationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public CrmValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
