package com.pwescrow.adapter.in.web.callback;

import com.pwescrow.adapter.in.web.ErrorResponses;
import com.pwescrow.adapter.in.web.action.EscrowActionHandler;
import com.pwescrow.adapter.in.web.dto.ErrorResponse;
import com.pwescrow.application.port.in.EscrowActionUseCase;
import com.pwescrow.application.port.in.EscrowActionUseCase.ActionCommand;
import com.pwescrow.domain.model.CallbackData;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * HTTP handler for raw keyboard callbacks
 * Handles POST /api/callbacks
 */
@Slf4j
@RequiredArgsConstructor
public class CallbackHandler implements Handler<RoutingContext> {

    private final EscrowActionUseCase actionUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ErrorResponses.send(context, 400, ErrorResponse.of("Request body is required", "bad_request"));
            return;
        }

        CallbackRequest request;
        try {
            request = requestBody.mapTo(CallbackRequest.class);
        } catch (Exception e) {
            log.error("Error parsing callback request", e);
            ErrorResponses.send(context, 400, ErrorResponse.of("Invalid request format: " + e.getMessage(), "bad_request"));
            return;
        }

        Optional<CallbackData> callback = CallbackData.parse(request.data());
        if (callback.isEmpty() || request.from() == null || request.from().isBlank()) {
            log.warn("Malformed callback '{}' from {}", request.data(), request.from());
            ErrorResponses.send(context, 400, ErrorResponse.of("Malformed action", "malformed"));
            return;
        }

        CallbackData data = callback.get();
        EscrowActionHandler.execute(context, actionUseCase,
                new ActionCommand(data.action(), data.escrowCode(), data.token(), request.from()));
    }
}
