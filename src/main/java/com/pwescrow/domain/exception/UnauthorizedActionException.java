package com.pwescrow.domain.exception;

import com.pwescrow.domain.model.PartyRole;
import lombok.Getter;

/**
 * The requesting party does not hold the role the action requires
 */
@Getter
public class UnauthorizedActionException extends EscrowException {

    private final PartyRole requiredRole;

    public UnauthorizedActionException(PartyRole requiredRole) {
        super("You are not authorized for this escrow (" + requiredRole.getLabel() + " only)");
        this.requiredRole = requiredRole;
    }

    @Override
    public String getReason() {
        return "unauthorized";
    }
}
