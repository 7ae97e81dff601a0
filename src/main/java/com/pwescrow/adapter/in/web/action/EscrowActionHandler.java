package com.pwescrow.adapter.in.web.action;

import com.pwescrow.adapter.in.web.ErrorResponses;
import com.pwescrow.adapter.in.web.dto.ErrorResponse;
import com.pwescrow.application.port.in.EscrowActionUseCase;
import com.pwescrow.application.port.in.EscrowActionUseCase.ActionCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for party actions
 * Handles POST /api/escrows/:code/actions
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowActionHandler implements Handler<RoutingContext> {

    private final EscrowActionUseCase actionUseCase;

    @Override
    public void handle(RoutingContext context) {
        String escrowCode = context.pathParam("code");
        JsonObject requestBody = context.body().asJsonObject();

        if (requestBody == null) {
            ErrorResponses.send(context, 400, ErrorResponse.of("Request body is required", "bad_request"));
            return;
        }

        EscrowActionRequest request;
        try {
            request = requestBody.mapTo(EscrowActionRequest.class);
        } catch (Exception e) {
            log.error("Error parsing action request", e);
            ErrorResponses.send(context, 400, ErrorResponse.of("Invalid request format: " + e.getMessage(), "bad_request"));
            return;
        }

        if (request.action() == null || request.requestingParty() == null) {
            ErrorResponses.send(context, 400, ErrorResponse.of("action and requestingParty are required", "bad_request"));
            return;
        }

        execute(context, actionUseCase, new ActionCommand(
                request.action(), escrowCode, request.token(), request.requestingParty()));
    }

    /**
     * Runs the command and writes either the outcome or the mapped failure
     */
    public static void execute(RoutingContext context, EscrowActionUseCase useCase, ActionCommand command) {
        useCase.performAction(command)
                .onSuccess(outcome -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(JsonObject.mapFrom(EscrowActionResponse.from(outcome)).encode()))
                .onFailure(error -> {
                    log.warn("Action {} on escrow {} by {} failed: {}",
                            command.action(), command.escrowCode(), command.requestingParty(), error.getMessage());
                    ErrorResponses.send(context, error);
                });
    }
}
