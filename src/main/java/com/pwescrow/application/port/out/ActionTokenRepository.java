package com.pwescrow.application.port.out;

import com.pwescrow.domain.model.ActionToken;
import com.pwescrow.domain.model.EscrowAction;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.Optional;

/**
 * Output port for action token persistence
 */
public interface ActionTokenRepository {

    Future<Void> save(ActionToken token, SqlConnection connection);

    /**
     * Find a token bound to the given escrow and action, locking its row
     * @return Future with optional token; empty when the token does not exist for this (escrow, action) pair
     */
    Future<Optional<ActionToken>> findForUpdate(String token, String escrowId, EscrowAction action, SqlConnection connection);

    /**
     * Flip {@code used} from false to true
     * @return Future with true when this call performed the flip
     */
    Future<Boolean> markUsed(String token, SqlConnection connection);
}
