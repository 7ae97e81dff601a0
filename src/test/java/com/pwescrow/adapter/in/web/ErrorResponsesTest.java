package com.pwescrow.adapter.in.web;

import com.pwescrow.adapter.in.web.dto.ErrorResponse;
import com.pwescrow.application.service.FormValidationException;
import com.pwescrow.domain.exception.EscrowNotFoundException;
import com.pwescrow.domain.exception.InvalidTransitionException;
import com.pwescrow.domain.exception.StorageFailureException;
import com.pwescrow.domain.exception.TokenDeniedException;
import com.pwescrow.domain.exception.UnauthorizedActionException;
import com.pwescrow.domain.exception.UnknownActionException;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.PartyRole;
import com.pwescrow.domain.model.TokenDenialReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorResponsesTest {

    @Test
    void statusFor_mapsEveryEngineFailure() {
        assertEquals(409, ErrorResponses.statusFor(new TokenDeniedException(TokenDenialReason.EXPIRED)));
        assertEquals(409, ErrorResponses.statusFor(new InvalidTransitionException(EscrowState.CANCELLED, EscrowState.AGREED)));
        assertEquals(403, ErrorResponses.statusFor(new UnauthorizedActionException(PartyRole.SELLER)));
        assertEquals(404, ErrorResponses.statusFor(new EscrowNotFoundException("PW-1")));
        assertEquals(503, ErrorResponses.statusFor(new StorageFailureException(new RuntimeException("down"))));
        assertEquals(400, ErrorResponses.statusFor(new UnknownActionException("steal")));
        assertEquals(400, ErrorResponses.statusFor(new FormValidationException(List.of("amount is required"))));
        assertEquals(500, ErrorResponses.statusFor(new RuntimeException("boom")));
    }

    @Test
    void bodyFor_carriesReasonAndNeverTheCause() {
        ErrorResponse denied = ErrorResponses.bodyFor(new TokenDeniedException(TokenDenialReason.ALREADY_USED));
        assertEquals("already_used", denied.reason());
        assertEquals("Action denied: This button has already been used", denied.message());

        ErrorResponse storage = ErrorResponses.bodyFor(new StorageFailureException(new RuntimeException("ORA-1234 at db01")));
        assertEquals("Something went wrong, please try again", storage.message());
        assertEquals("storage_failure", storage.reason());

        ErrorResponse internal = ErrorResponses.bodyFor(new NullPointerException("escrow 5c1e..."));
        assertEquals("internal_error", internal.reason());
        assertFalse(internal.message().contains("5c1e"));
    }

    @Test
    void bodyFor_listsFormErrors() {
        ErrorResponse body = ErrorResponses.bodyFor(new FormValidationException(List.of("a", "b")));

        assertEquals("validation_failed", body.reason());
        assertEquals(List.of("a", "b"), body.errors());
    }
}
