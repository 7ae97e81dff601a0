package com.pwescrow.application.port.in;

import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.StateChange;
import io.vertx.core.Future;

import java.util.List;
import java.util.Set;

/**
 * Input port for party actions on an existing escrow
 */
public interface EscrowActionUseCase {

    /**
     * Perform a token-authorized action as one atomic unit.
     * Fails with an {@link com.pwescrow.domain.exception.EscrowException} subtype; nothing is applied on failure.
     * @param command The action request
     * @return Future with the outcome after commit
     */
    Future<ActionOutcome> performAction(ActionCommand command);

    /**
     * Command object for an action request coming from the chat transport
     */
    record ActionCommand(
            String action,
            String escrowCode,
            String token,
            String requestingParty
    ) {}

    enum OutcomeStatus {
        TRANSITIONED,
        PENDING
    }

    record ActionOutcome(
            String escrowCode,
            EscrowAction action,
            OutcomeStatus status,
            EscrowState state,
            Set<String> waitingOn,
            List<StateChange> changes
    ) {}
}
