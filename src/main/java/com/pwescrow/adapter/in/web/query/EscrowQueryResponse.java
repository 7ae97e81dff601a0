package com.pwescrow.adapter.in.web.query;

import com.pwescrow.application.port.in.EscrowQueryUseCase.EscrowView;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.Escrow;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Public view of an escrow; the internal id is never exposed
 */
public record EscrowQueryResponse(
        String escrowCode,
        String state,
        String buyer,
        String seller,
        String dealTitle,
        String description,
        BigDecimal amount,
        BigDecimal feeAmount,
        String deliveryDeadline,
        String refundConditions,
        Boolean disputeAgreement,
        String createdAt,
        String updatedAt,
        List<LogEntry> log
) {
    public static EscrowQueryResponse from(EscrowView view) {
        Escrow escrow = view.escrow();
        return new EscrowQueryResponse(
                escrow.getEscrowCode(),
                escrow.getState().getValue(),
                escrow.getBuyerId(),
                escrow.getSellerId(),
                escrow.getDealTitle(),
                escrow.getDescription(),
                escrow.getAmount(),
                escrow.getFeeAmount(),
                String.valueOf(escrow.getDeliveryDeadline()),
                escrow.getRefundConditions(),
                escrow.getDisputeAgreement(),
                String.valueOf(escrow.getCreatedAt()),
                String.valueOf(escrow.getUpdatedAt()),
                view.log().stream().map(LogEntry::from).toList()
        );
    }

    public record LogEntry(String actor, String action, Map<String, Object> payload, String at) {
        static LogEntry from(ActionLogEntry entry) {
            return new LogEntry(entry.getActorId(), entry.getAction(),
                    entry.getPayload().getMap(), String.valueOf(entry.getCreatedAt()));
        }
    }
}
