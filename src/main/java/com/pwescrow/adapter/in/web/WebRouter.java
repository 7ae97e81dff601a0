package com.pwescrow.adapter.in.web;

import com.pwescrow.adapter.in.web.action.EscrowActionHandler;
import com.pwescrow.adapter.in.web.callback.CallbackHandler;
import com.pwescrow.adapter.in.web.form.EscrowFormHandler;
import com.pwescrow.adapter.in.web.query.EscrowQueryHandler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for escrow endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final EscrowFormHandler formHandler;
    private final EscrowActionHandler actionHandler;
    private final CallbackHandler callbackHandler;
    private final EscrowQueryHandler queryHandler;

    public void setupRoutes() {
        router.post("/api/escrows").handler(formHandler);
        router.post("/api/escrows/:code/actions").handler(actionHandler);
        router.get("/api/escrows/:code").handler(queryHandler);
        router.post("/api/callbacks").handler(callbackHandler);

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end(new JsonObject()
                                .put("status", "UP")
                                .put("service", "pw-escrow-engine")
                                .encode()));
    }
}
