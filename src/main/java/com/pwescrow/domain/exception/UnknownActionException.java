package com.pwescrow.domain.exception;

/**
 * Action name that the engine does not know; reported as a normal denial
 */
public class UnknownActionException extends EscrowException {

    public UnknownActionException(String action) {
        super("Unknown action: " + action);
    }

    @Override
    public String getReason() {
        return "unknown_action";
    }
}
