package com.pwescrow.application.service;

import java.util.List;

/**
 * Result of validating a submitted escrow form
 */
public record ValidationResult(List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors);
    }
}
