package com.pwescrow.application.service;

import lombok.Getter;

import java.util.List;

/**
 * Submitted form was rejected; every problem found is listed
 */
@Getter
public class FormValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public FormValidationException(List<String> errors) {
        super("Invalid escrow form: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
