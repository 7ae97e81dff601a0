package com.pwescrow.domain.model;

/**
 * Lifecycle state of an escrow
 */
public enum EscrowState {
    CREATED("CREATED"),
    FORM_SUBMITTED("FORM_SUBMITTED"),
    AGREEMENT_PREVIEW("AGREEMENT_PREVIEW"),
    AGREED("AGREED"),
    FUNDED("FUNDED"),
    DELIVERED("DELIVERED"),
    RELEASE_REQUESTED("RELEASE_REQUESTED"),
    RELEASE_CONFIRMED("RELEASE_CONFIRMED"),
    COMPLETED("COMPLETED"),
    DISPUTED("DISPUTED"),
    CANCELLED("CANCELLED"),
    EXPIRED("EXPIRED");

    private final String value;

    EscrowState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EscrowState initial() {
        return CREATED;
    }

    public static EscrowState fromValue(String value) {
        for (EscrowState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown escrow state: " + value);
    }

    public static boolean isValid(String value) {
        for (EscrowState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
