package com.pwescrow.adapter.in.web;

import com.pwescrow.adapter.in.web.dto.ErrorResponse;
import com.pwescrow.application.service.FormValidationException;
import com.pwescrow.domain.exception.EscrowException;
import com.pwescrow.domain.exception.EscrowNotFoundException;
import com.pwescrow.domain.exception.InvalidTransitionException;
import com.pwescrow.domain.exception.StorageFailureException;
import com.pwescrow.domain.exception.TokenDeniedException;
import com.pwescrow.domain.exception.UnauthorizedActionException;
import com.pwescrow.domain.exception.UnknownActionException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Maps engine failures to HTTP status codes and error bodies
 */
public final class ErrorResponses {

    private ErrorResponses() {
    }

    public static int statusFor(Throwable error) {
        if (error instanceof TokenDeniedException || error instanceof InvalidTransitionException) {
            return 409;
        }
        if (error instanceof UnauthorizedActionException) {
            return 403;
        }
        if (error instanceof EscrowNotFoundException) {
            return 404;
        }
        if (error instanceof StorageFailureException) {
            return 503;
        }
        if (error instanceof UnknownActionException || error instanceof IllegalArgumentException) {
            return 400;
        }
        return 500;
    }

    public static ErrorResponse bodyFor(Throwable error) {
        if (error instanceof FormValidationException validation) {
            return ErrorResponse.of("Invalid escrow form", validation.getErrors());
        }
        if (error instanceof EscrowException escrowError) {
            return ErrorResponse.of(escrowError.getMessage(), escrowError.getReason());
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorResponse.of(error.getMessage(), "bad_request");
        }
        return ErrorResponse.of("Something went wrong, please try again", "internal_error");
    }

    public static void send(RoutingContext context, Throwable error) {
        send(context, statusFor(error), bodyFor(error));
    }

    public static void send(RoutingContext context, int statusCode, ErrorResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}
