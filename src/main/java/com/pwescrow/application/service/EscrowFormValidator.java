package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowFormUseCase.EscrowFormCommand;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates escrow forms and parses their free-text fields
 */
public class EscrowFormValidator {

    private static final int MAX_TEXT_LENGTH = 1000;
    private static final int MAX_TITLE_LENGTH = 255;
    private static final int MAX_IDENTITY_LENGTH = 64;         // chat, party and user ids are VARCHAR(64)
    private static final int MAX_NAME_LENGTH = 255;
    private static final int MAX_AMOUNT_INTEGER_DIGITS = 16;   // NUMERIC(18,2)
    private static final int MAX_DELIVERY_HOURS = 24 * 365;

    private static final Pattern DELIVERY = Pattern.compile(
            "^(\\d{1,5})\\s*(h|hr|hrs|hour|hours|d|day|days)?$", Pattern.CASE_INSENSITIVE);

    /**
     * Validate a form command
     */
    public ValidationResult validate(EscrowFormCommand command) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(command, errors);
        validateParties(command, errors);
        validateAmount(command, errors);
        validateDelivery(command, errors);
        validateLengths(command, errors);

        if (!isBlank(command.disputeAgreement()) && parseYesNo(command.disputeAgreement()) == null) {
            errors.add("dispute agreement must be Yes or No");
        }

        return ValidationResult.of(errors);
    }

    private void validateRequiredFields(EscrowFormCommand command, List<String> errors) {
        if (isBlank(command.chatId())) {
            errors.add("chat is required");
        }
        if (command.creator() == null || isBlank(command.creator().getId())) {
            errors.add("creator is required");
        }
        if (isBlank(command.buyer())) {
            errors.add("buyer is required");
        }
        if (isBlank(command.seller())) {
            errors.add("seller is required");
        }
        if (isBlank(command.dealTitle())) {
            errors.add("deal title is required");
        }
        if (isBlank(command.amount())) {
            errors.add("amount is required");
        }
    }

    private void validateParties(EscrowFormCommand command, List<String> errors) {
        if (!isBlank(command.buyer()) && !isBlank(command.seller())
                && command.buyer().trim().equalsIgnoreCase(command.seller().trim())) {
            errors.add("buyer and seller must be different");
        }
    }

    private void validateAmount(EscrowFormCommand command, List<String> errors) {
        if (isBlank(command.amount())) {
            return;
        }
        BigDecimal amount;
        try {
            amount = parseAmount(command.amount());
        } catch (NumberFormatException e) {
            errors.add("Invalid amount. Use only numbers like 10000 or 10,000");
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("amount must be positive");
        }
        if (amount.scale() > 2) {
            errors.add("amount must have at most 2 decimal places");
        }
        if (amount.precision() - amount.scale() > MAX_AMOUNT_INTEGER_DIGITS) {
            errors.add("amount is too large");
        }
    }

    private void validateDelivery(EscrowFormCommand command, List<String> errors) {
        if (isBlank(command.delivery())) {
            return;
        }
        OptionalInt hours = parseDeliveryHours(command.delivery());
        if (hours.isEmpty()) {
            errors.add("delivery time must look like 24h or 3d");
        } else if (hours.getAsInt() <= 0 || hours.getAsInt() > MAX_DELIVERY_HOURS) {
            errors.add("delivery time must be between 1 hour and 365 days");
        }
    }

    private void validateLengths(EscrowFormCommand command, List<String> errors) {
        checkIdentity("chat", command.chatId(), errors);
        checkIdentity("buyer", command.buyer(), errors);
        checkIdentity("seller", command.seller(), errors);
        if (command.creator() != null) {
            checkIdentity("creator", command.creator().getId(), errors);
            checkName("creator username", command.creator().getUsername(), errors);
            checkName("creator first name", command.creator().getFirstName(), errors);
            checkName("creator last name", command.creator().getLastName(), errors);
        }
        if (command.dealTitle() != null && command.dealTitle().length() > MAX_TITLE_LENGTH) {
            errors.add("deal title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (command.description() != null && command.description().length() > MAX_TEXT_LENGTH) {
            errors.add("description must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        if (command.refundConditions() != null && command.refundConditions().length() > MAX_TEXT_LENGTH) {
            errors.add("refund conditions must be at most " + MAX_TEXT_LENGTH + " characters");
        }
    }

    private void checkIdentity(String field, String value, List<String> errors) {
        if (value != null && value.trim().length() > MAX_IDENTITY_LENGTH) {
            errors.add(field + " must be at most " + MAX_IDENTITY_LENGTH + " characters");
        }
    }

    private void checkName(String field, String value, List<String> errors) {
        if (value != null && value.length() > MAX_NAME_LENGTH) {
            errors.add(field + " must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    /**
     * Parse an amount such as "10,000.50"
     * @throws NumberFormatException if the text is not a number
     */
    public static BigDecimal parseAmount(String text) {
        return new BigDecimal(text.trim().replace(",", ""));
    }

    /**
     * Parse "24h", "3d", "48 hours" or a bare number of hours
     */
    public static OptionalInt parseDeliveryHours(String text) {
        Matcher matcher = DELIVERY.matcher(text.trim());
        if (!matcher.matches()) {
            return OptionalInt.empty();
        }
        int value = Integer.parseInt(matcher.group(1));
        String unit = matcher.group(2);
        boolean days = unit != null && unit.toLowerCase(Locale.ROOT).startsWith("d");
        return OptionalInt.of(days ? value * 24 : value);
    }

    /**
     * @return TRUE for answers starting with y, FALSE for answers starting with n, null otherwise
     */
    public static Boolean parseYesNo(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("y")) {
            return Boolean.TRUE;
        }
        if (normalized.startsWith("n")) {
            return Boolean.FALSE;
        }
        return null;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
