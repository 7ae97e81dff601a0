package com.pwescrow.domain.model;

import java.util.Optional;

/**
 * Keyboard callback payload in the form {@code action|escrow_code|token}
 */
public record CallbackData(String action, String escrowCode, String token) {

    public static final String SEPARATOR = "|";

    public String encode() {
        return action + SEPARATOR + escrowCode + SEPARATOR + token;
    }

    public static CallbackData of(String escrowCode, ActionOffer offer) {
        return new CallbackData(offer.action().getValue(), escrowCode, offer.token());
    }

    /**
     * @return empty unless the data has exactly three non-blank parts
     */
    public static Optional<CallbackData> parse(String data) {
        if (data == null) {
            return Optional.empty();
        }
        String[] parts = data.split("\\|", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        for (String part : parts) {
            if (part.isBlank()) {
                return Optional.empty();
            }
        }
        return Optional.of(new CallbackData(parts[0].trim(), parts[1].trim(), parts[2].trim()));
    }
}
