package com.pwescrow.application.port.out;

import com.pwescrow.domain.model.ActionLogEntry;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.util.List;
import java.util.Set;

/**
 * Output port for the append-only escrow log
 */
public interface EscrowLogRepository {

    Future<Void> append(ActionLogEntry entry, SqlConnection connection);

    /**
     * Distinct actors that have logged the given action for an escrow
     */
    Future<Set<String>> findDistinctActors(String escrowId, String action, SqlConnection connection);

    Future<List<ActionLogEntry>> findByEscrow(String escrowId);
}
