package com.pwescrow.adapter.in.web.query;

import com.pwescrow.adapter.in.web.ErrorResponses;
import com.pwescrow.application.port.in.EscrowQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles GET /api/escrows/:code
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowQueryHandler implements Handler<RoutingContext> {

    private final EscrowQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String escrowCode = context.pathParam("code");

        queryUseCase.findByCode(escrowCode)
                .onSuccess(view -> context.response()
                        .putHeader("Content-Type", "application/json")
                        .end(JsonObject.mapFrom(EscrowQueryResponse.from(view)).encode()))
                .onFailure(error -> {
                    log.warn("Lookup of escrow {} failed: {}", escrowCode, error.getMessage());
                    ErrorResponses.send(context, error);
                });
    }
}
