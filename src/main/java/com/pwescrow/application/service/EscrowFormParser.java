package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowFormUseCase.EscrowFormCommand;
import com.pwescrow.domain.model.ChatUser;

import java.util.Arrays;
import java.util.List;

/**
 * Splits the single-message escrow form into its eight fields:
 * buyer, seller, deal title, description, amount, delivery time, refund conditions, dispute agreement.
 */
public class EscrowFormParser {

    public static final int FIELD_COUNT = 8;

    public static final String TEMPLATE = String.join("\n",
            "<BuyerUsername or ID>",
            "<SellerUsername or ID>",
            "<Deal Title>",
            "<Product / Service Description>",
            "<Total Amount>",
            "<Delivery Time (hours/days)>",
            "<Refund Conditions>",
            "<Dispute Resolution Agreement (Yes/No)>");

    /**
     * @throws FormValidationException when fewer than eight non-empty lines are present
     */
    public EscrowFormCommand parse(String chatId, ChatUser creator, String text) {
        List<String> lines = text == null ? List.of() : Arrays.stream(text.strip().split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();

        if (lines.size() < FIELD_COUNT) {
            throw new FormValidationException(List.of(
                    "Invalid form: expected " + FIELD_COUNT + " non-empty lines. Please follow the template."));
        }

        return new EscrowFormCommand(
                chatId,
                creator,
                lines.get(0),
                lines.get(1),
                lines.get(2),
                lines.get(3),
                lines.get(4),
                lines.get(5),
                lines.get(6),
                lines.get(7)
        );
    }
}
