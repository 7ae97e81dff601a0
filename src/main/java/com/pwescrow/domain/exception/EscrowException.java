package com.pwescrow.domain.exception;

/**
 * Base class for failures decided by the escrow engine.
 * The message is user-facing and never carries internal identifiers.
 */
public abstract class EscrowException extends RuntimeException {

    protected EscrowException(String message) {
        super(message);
    }

    protected EscrowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason, e.g. "already_used"
     */
    public abstract String getReason();
}
