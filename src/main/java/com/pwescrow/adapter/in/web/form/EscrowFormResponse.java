package com.pwescrow.adapter.in.web.form;

import com.pwescrow.adapter.in.web.dto.OfferView;
import com.pwescrow.application.port.in.EscrowFormUseCase.FormOutcome;

import java.math.BigDecimal;
import java.util.List;

public record EscrowFormResponse(
        String status,
        String escrowCode,
        String state,
        BigDecimal amount,
        BigDecimal feeAmount,
        List<OfferView> offers
) {
    public static EscrowFormResponse from(FormOutcome outcome) {
        return new EscrowFormResponse(
                "success",
                outcome.escrowCode(),
                outcome.state().getValue(),
                outcome.amount(),
                outcome.feeAmount(),
                outcome.offers().stream()
                        .map(offer -> OfferView.from(outcome.escrowCode(), offer))
                        .toList()
        );
    }
}
