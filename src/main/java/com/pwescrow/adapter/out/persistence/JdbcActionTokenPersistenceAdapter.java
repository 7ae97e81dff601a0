package com.pwescrow.adapter.out.persistence;

import com.pwescrow.application.port.out.ActionTokenRepository;
import com.pwescrow.domain.model.ActionToken;
import com.pwescrow.domain.model.EscrowAction;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * JDBC implementation of ActionTokenRepository.
 * Every statement runs on the caller's connection; tokens are only touched inside a unit of work.
 */
@Slf4j
public class JdbcActionTokenPersistenceAdapter implements ActionTokenRepository {

    @Override
    public Future<Void> save(ActionToken token, SqlConnection connection) {
        String sql = "INSERT INTO action_tokens " +
                "(token, escrow_id, action, user_id, created_at, expires_at, used) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.of(
                token.getToken(),
                token.getEscrowId(),
                token.getAction().getValue(),
                token.getPartyId(),
                token.getCreatedAt(),
                token.getExpiresAt(),
                token.isUsed()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .onFailure(error -> log.error("Failed to save {} token for escrow {}: {}",
                        token.getAction().getValue(), token.getEscrowId(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Optional<ActionToken>> findForUpdate(String token, String escrowId, EscrowAction action,
                                                       SqlConnection connection) {
        String sql = "SELECT token, escrow_id, action, user_id, created_at, expires_at, used " +
                "FROM action_tokens WHERE token = ? AND escrow_id = ? AND action = ? FOR UPDATE";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(token, escrowId, action.getValue()))
                .map(result -> result.size() > 0
                        ? Optional.of(mapToToken(result.iterator().next()))
                        : Optional.<ActionToken>empty());
    }

    @Override
    public Future<Boolean> markUsed(String token, SqlConnection connection) {
        String sql = "UPDATE action_tokens SET used = TRUE WHERE token = ? AND used = FALSE";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(token))
                .map(result -> result.rowCount() == 1);
    }

    private ActionToken mapToToken(Row row) {
        return ActionToken.builder()
                .token(row.getString("token"))
                .escrowId(row.getString("escrow_id"))
                .action(EscrowAction.fromValue(row.getString("action")))
                .partyId(row.getString("user_id"))
                .createdAt(row.getLocalDateTime("created_at"))
                .expiresAt(row.getLocalDateTime("expires_at"))
                .used(Boolean.TRUE.equals(row.getBoolean("used")))
                .build();
    }
}
