package com.pwescrow.domain.event;

import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.EscrowState;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Domain event for the notification side.
 * Published only after the unit of work that caused it has committed; ACTION_DENIED is never persisted.
 */
@Value
@Builder
public class EscrowEvent {
    EscrowEventType type;
    String escrowCode;
    String chatId;
    EscrowState from;           // STATE_CHANGED only
    EscrowState to;             // STATE_CHANGED only
    BigDecimal amount;
    String reason;              // ACTION_DENIED only
    String actorId;
    @Singular("waitingParty")
    Set<String> waitingOn;      // JOINT_CONDITION_PENDING only
    @Singular
    List<ActionOffer> offers;   // STATE_CHANGED only

    public static EscrowEvent created(String escrowCode, String chatId, BigDecimal amount, String actorId) {
        return EscrowEvent.builder()
                .type(EscrowEventType.ESCROW_CREATED)
                .escrowCode(escrowCode)
                .chatId(chatId)
                .amount(amount)
                .actorId(actorId)
                .build();
    }

    public static EscrowEvent stateChanged(String escrowCode, String chatId, EscrowState from, EscrowState to,
                                           BigDecimal amount, String actorId, List<ActionOffer> offers) {
        return EscrowEvent.builder()
                .type(EscrowEventType.STATE_CHANGED)
                .escrowCode(escrowCode)
                .chatId(chatId)
                .from(from)
                .to(to)
                .amount(amount)
                .actorId(actorId)
                .offers(offers)
                .build();
    }

    public static EscrowEvent denied(String escrowCode, String chatId, String actorId, String reason) {
        return EscrowEvent.builder()
                .type(EscrowEventType.ACTION_DENIED)
                .escrowCode(escrowCode)
                .chatId(chatId)
                .actorId(actorId)
                .reason(reason)
                .build();
    }

    public static EscrowEvent pending(String escrowCode, String chatId, String actorId, Set<String> waitingOn) {
        return EscrowEvent.builder()
                .type(EscrowEventType.JOINT_CONDITION_PENDING)
                .escrowCode(escrowCode)
                .chatId(chatId)
                .actorId(actorId)
                .waitingOn(waitingOn)
                .build();
    }
}
