package com.pwescrow.adapter.out.persistence;

import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.domain.model.ActionLogEntry;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JDBC implementation of the append-only escrow log.
 * Payloads are stored as JSON text.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcEscrowLogPersistenceAdapter implements EscrowLogRepository {

    private final SqlClient sqlClient;

    @Override
    public Future<Void> append(ActionLogEntry entry, SqlConnection connection) {
        String sql = "INSERT INTO escrow_logs " +
                "(id, escrow_id, chat_id, actor_id, action, payload, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)";

        JsonObject payload = entry.getPayload() == null ? new JsonObject() : entry.getPayload();
        Tuple params = Tuple.of(
                entry.getId(),
                entry.getEscrowId(),
                entry.getChatId(),
                entry.getActorId(),
                entry.getAction(),
                payload.encode(),
                entry.getCreatedAt()
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .onFailure(error -> log.error("Failed to append '{}' log entry: {}", entry.getAction(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Set<String>> findDistinctActors(String escrowId, String action, SqlConnection connection) {
        String sql = "SELECT DISTINCT actor_id FROM escrow_logs WHERE escrow_id = ? AND action = ?";

        return connection.preparedQuery(sql)
                .execute(Tuple.of(escrowId, action))
                .map(result -> {
                    Set<String> actors = new HashSet<>();
                    for (Row row : result) {
                        String actor = row.getString("actor_id");
                        if (actor != null) {
                            actors.add(actor);
                        }
                    }
                    return actors;
                });
    }

    @Override
    public Future<List<ActionLogEntry>> findByEscrow(String escrowId) {
        String sql = "SELECT id, escrow_id, chat_id, actor_id, action, payload, created_at " +
                "FROM escrow_logs WHERE escrow_id = ? ORDER BY entry_no";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(escrowId))
                .map(result -> {
                    List<ActionLogEntry> entries = new ArrayList<>();
                    for (Row row : result) {
                        entries.add(mapToEntry(row));
                    }
                    return entries;
                });
    }

    private ActionLogEntry mapToEntry(Row row) {
        String payload = row.getString("payload");
        return ActionLogEntry.builder()
                .id(row.getString("id"))
                .escrowId(row.getString("escrow_id"))
                .chatId(row.getString("chat_id"))
                .actorId(row.getString("actor_id"))
                .action(row.getString("action"))
                .payload(payload == null ? new JsonObject() : new JsonObject(payload))
                .createdAt(row.getLocalDateTime("created_at"))
                .build();
    }
}
