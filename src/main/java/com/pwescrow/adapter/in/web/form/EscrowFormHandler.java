package com.pwescrow.adapter.in.web.form;

import com.pwescrow.adapter.in.web.ErrorResponses;
import com.pwescrow.adapter.in.web.dto.ErrorResponse;
import com.pwescrow.application.port.in.EscrowFormUseCase;
import com.pwescrow.application.port.in.EscrowFormUseCase.EscrowFormCommand;
import com.pwescrow.application.service.EscrowFormParser;
import com.pwescrow.domain.model.ChatUser;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for escrow form submission
 * Handles POST /api/escrows
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowFormHandler implements Handler<RoutingContext> {

    private final EscrowFormUseCase formUseCase;
    private final EscrowFormParser formParser;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();

        if (requestBody == null) {
            log.warn("Escrow form request without body");
            ErrorResponses.send(context, 400, ErrorResponse.of("Request body is required", "bad_request"));
            return;
        }

        EscrowFormCommand command;
        try {
            EscrowFormRequest request = requestBody.mapTo(EscrowFormRequest.class);
            command = toCommand(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected escrow form: {}", e.getMessage());
            ErrorResponses.send(context, e);
            return;
        } catch (Exception e) {
            log.error("Error parsing escrow form request", e);
            ErrorResponses.send(context, 400, ErrorResponse.of("Invalid request format: " + e.getMessage(), "bad_request"));
            return;
        }

        formUseCase.submitForm(command)
                .onSuccess(outcome -> {
                    log.info("Escrow {} created from chat {}", outcome.escrowCode(), command.chatId());
                    context.response()
                            .setStatusCode(201)
                            .putHeader("Content-Type", "application/json")
                            .end(JsonObject.mapFrom(EscrowFormResponse.from(outcome)).encode());
                })
                .onFailure(error -> {
                    log.warn("Escrow form from chat {} failed: {}", command.chatId(), error.getMessage());
                    ErrorResponses.send(context, error);
                });
    }

    private EscrowFormCommand toCommand(EscrowFormRequest request) {
        ChatUser creator = request.creator() == null ? null : ChatUser.builder()
                .id(request.creator().id())
                .username(request.creator().username())
                .firstName(request.creator().firstName())
                .lastName(request.creator().lastName())
                .build();

        if (request.isTextForm()) {
            return formParser.parse(request.chatId(), creator, request.form());
        }

        return new EscrowFormCommand(
                request.chatId(),
                creator,
                request.buyer(),
                request.seller(),
                request.dealTitle(),
                request.description(),
                request.amount(),
                request.delivery(),
                request.refundConditions(),
                request.disputeAgreement()
        );
    }
}
