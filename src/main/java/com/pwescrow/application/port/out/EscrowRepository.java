package com.pwescrow.application.port.out;

import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Output port for escrow persistence
 */
public interface EscrowRepository {

    /**
     * Allocate the next public escrow code, e.g. PW-100000
     * @param prefix Code prefix from configuration
     * @param connection Database connection (for transaction support)
     */
    Future<String> nextEscrowCode(String prefix, SqlConnection connection);

    Future<Void> insert(Escrow escrow, SqlConnection connection);

    /**
     * Find an escrow by its public code and lock its row until the transaction ends
     * @param escrowCode Public escrow code
     * @param connection Database connection holding the transaction
     * @return Future with optional escrow
     */
    Future<Optional<Escrow>> findByCodeForUpdate(String escrowCode, SqlConnection connection);

    Future<Optional<Escrow>> findByCode(String escrowCode);

    /**
     * Compare-and-set the escrow state
     * @param escrowId Escrow identifier
     * @param expected State the caller read under lock
     * @param target New state
     * @param updatedAt Update timestamp
     * @param connection Database connection
     * @return Future with true when exactly one row moved from {@code expected} to {@code target}
     */
    Future<Boolean> updateState(String escrowId, EscrowState expected, EscrowState target,
                                LocalDateTime updatedAt, SqlConnection connection);
}
