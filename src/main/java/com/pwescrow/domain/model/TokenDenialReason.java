package com.pwescrow.domain.model;

/**
 * Why an action token was refused. Every reason is final for the token presented.
 */
public enum TokenDenialReason {
    INVALID_TOKEN("invalid_token", "This button is not valid for this escrow"),
    ALREADY_USED("already_used", "This button has already been used"),
    WRONG_USER("wrong_user", "This button belongs to another participant"),
    EXPIRED("expired", "This button has expired");

    private final String value;
    private final String message;

    TokenDenialReason(String value, String message) {
        this.value = value;
        this.message = message;
    }

    public String getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }
}
