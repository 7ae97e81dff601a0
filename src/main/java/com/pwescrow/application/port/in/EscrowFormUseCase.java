package com.pwescrow.application.port.in;

import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.ChatUser;
import com.pwescrow.domain.model.EscrowState;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for opening a new escrow from a submitted form
 */
public interface EscrowFormUseCase {

    /**
     * Validate the form, create the escrow and move it to AGREEMENT_PREVIEW with per-party tokens
     * @param command The submitted form
     * @return Future with the created escrow's public code and the offers to render
     */
    Future<FormOutcome> submitForm(EscrowFormCommand command);

    /**
     * Raw form fields as typed by the user; amount and delivery are parsed during validation
     */
    record EscrowFormCommand(
            String chatId,
            ChatUser creator,
            String buyer,
            String seller,
            String dealTitle,
            String description,
            String amount,
            String delivery,
            String refundConditions,
            String disputeAgreement
    ) {}

    record FormOutcome(
            String escrowCode,
            EscrowState state,
            BigDecimal amount,
            BigDecimal feeAmount,
            List<ActionOffer> offers
    ) {}
}
