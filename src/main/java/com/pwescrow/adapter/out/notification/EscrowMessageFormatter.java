package com.pwescrow.adapter.out.notification;

import com.pwescrow.application.port.out.ChatNotifier.ChatButton;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.CallbackData;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.PartyRole;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps escrow events to the chat messages they produce.
 * Events without a chat reference (denials) only reach the log chat.
 */
public class EscrowMessageFormatter {

    private final EscrowSettings settings;
    private final PaymentInstructions paymentInstructions;

    public EscrowMessageFormatter(EscrowSettings settings, PaymentInstructions paymentInstructions) {
        this.settings = settings;
        this.paymentInstructions = paymentInstructions;
    }

    public List<OutgoingMessage> format(EscrowEvent event) {
        List<OutgoingMessage> messages = new ArrayList<>();
        switch (event.getType()) {
            case ESCROW_CREATED -> {
                addToChat(messages, event, "Escrow " + event.getEscrowCode() + " opened for " + money(event.getAmount()));
                addToLog(messages, "New escrow " + event.getEscrowCode() + " - amount " + money(event.getAmount()));
            }
            case STATE_CHANGED -> formatStateChange(messages, event);
            case JOINT_CONDITION_PENDING -> addToChat(messages, event,
                    "Your agreement is recorded. Waiting for: " + String.join(", ", event.getWaitingOn()));
            case ACTION_DENIED -> addToLog(messages,
                    "Action denied on " + event.getEscrowCode() + " for " + event.getActorId() + ": " + event.getReason());
        }
        return messages;
    }

    private void formatStateChange(List<OutgoingMessage> messages, EscrowEvent event) {
        String code = event.getEscrowCode();
        EscrowState to = event.getTo();
        List<ChatButton> buttons = buttonsFor(code, event.getOffers());

        switch (to) {
            case AGREEMENT_PREVIEW -> addToChat(messages, event,
                    "PW ESCROW AGREEMENT " + code + "\nAmount: " + money(event.getAmount())
                            + "\nBuyer and Seller must both agree. Proceed?", buttons);
            case AGREED -> {
                addToChat(messages, event, "Both parties agreed. Escrow " + code + " is now AGREED.", buttons);
                addToChat(messages, event, paymentInstructions.caption(event.getAmount(), code));
                addToLog(messages, "PAYMENT AVAILABLE for " + code + " - amount " + money(event.getAmount()));
            }
            case FUNDED -> addToChat(messages, event,
                    "Buyer reported payment for " + code + ". Seller, deliver and mark as delivered.", buttons);
            case DELIVERED -> addToChat(messages, event,
                    "Seller marked " + code + " as delivered. Buyer, release funds once satisfied.", buttons);
            case RELEASE_REQUESTED -> addToChat(messages, event,
                    "Release funds for " + code + "? This cannot be undone.", buttons);
            case COMPLETED -> {
                addToChat(messages, event, "Escrow " + code + " completed. Funds released to the seller.");
                addToLog(messages, "Escrow " + code + " completed");
            }
            case CANCELLED -> {
                addToChat(messages, event, "Escrow " + code + " has been cancelled.");
                addToLog(messages, "Escrow " + code + " cancelled by " + event.getActorId());
            }
            case DISPUTED -> {
                addToChat(messages, event, "Dispute opened on " + code + ". PW Escrow admins will review.");
                addToLog(messages, "DISPUTE on " + code + " opened by " + event.getActorId());
            }
            default -> {
                // intermediate states carry no user-facing message
            }
        }
    }

    List<ChatButton> buttonsFor(String escrowCode, List<ActionOffer> offers) {
        List<ChatButton> buttons = new ArrayList<>();
        for (ActionOffer offer : offers) {
            String label = offer.action().getRole() == PartyRole.EITHER
                    ? offer.action().getLabel() + " (" + offer.partyId() + ")"
                    : offer.action().getLabel();
            buttons.add(new ChatButton(label, CallbackData.of(escrowCode, offer).encode()));
        }
        return buttons;
    }

    private void addToChat(List<OutgoingMessage> messages, EscrowEvent event, String text) {
        addToChat(messages, event, text, List.of());
    }

    private void addToChat(List<OutgoingMessage> messages, EscrowEvent event, String text, List<ChatButton> buttons) {
        if (event.getChatId() != null) {
            messages.add(new OutgoingMessage(event.getChatId(), text, buttons));
        }
    }

    private void addToLog(List<OutgoingMessage> messages, String text) {
        if (settings.getLogGroupId() != null) {
            messages.add(new OutgoingMessage(settings.getLogGroupId(), text, List.of()));
        }
    }

    static String money(BigDecimal value) {
        return value == null ? "-" : String.format(Locale.ENGLISH, "₹%,.2f", value);
    }

    public record OutgoingMessage(String chatId, String text, List<ChatButton> buttons) {}
}
