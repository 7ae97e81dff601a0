package com.pwescrow.domain.exception;

/**
 * The unit of work could not be committed. Nothing was applied; the caller may retry with a fresh request.
 */
public class StorageFailureException extends EscrowException {

    public StorageFailureException(Throwable cause) {
        super("Something went wrong, please try again", cause);
    }

    @Override
    public String getReason() {
        return "storage_failure";
    }
}
