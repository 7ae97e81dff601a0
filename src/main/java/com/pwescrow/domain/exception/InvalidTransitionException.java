package com.pwescrow.domain.exception;

import com.pwescrow.domain.model.EscrowState;
import lombok.Getter;

/**
 * A state change that is not an edge of the transition graph, usually a race lost to the other party
 */
@Getter
public class InvalidTransitionException extends EscrowException {

    private final EscrowState from;
    private final EscrowState to;

    public InvalidTransitionException(EscrowState from, EscrowState to) {
        super("This action is no longer available");
        this.from = from;
        this.to = to;
    }

    @Override
    public String getReason() {
        return "invalid_transition";
    }
}
