package com.pwescrow.adapter.out.persistence;

import com.pwescrow.application.port.out.UserRepository;
import com.pwescrow.domain.model.ChatUser;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * JDBC implementation of UserRepository
 */
@Slf4j
public class JdbcUserPersistenceAdapter implements UserRepository {

    private final Clock clock;

    public JdbcUserPersistenceAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Future<Void> upsert(ChatUser user, SqlConnection connection) {
        String sql = "MERGE INTO users u " +
                "USING (SELECT CAST(? AS VARCHAR(64)) AS id, CAST(? AS VARCHAR(255)) AS username, " +
                "CAST(? AS VARCHAR(255)) AS first_name, CAST(? AS VARCHAR(255)) AS last_name, " +
                "CAST(? AS TIMESTAMP) AS created_at) src " +
                "ON (u.id = src.id) " +
                "WHEN MATCHED THEN UPDATE SET " +
                "  username = src.username, " +
                "  first_name = src.first_name, " +
                "  last_name = src.last_name " +
                "WHEN NOT MATCHED THEN INSERT (id, username, first_name, last_name, created_at) " +
                "VALUES (src.id, src.username, src.first_name, src.last_name, src.created_at)";

        Tuple params = Tuple.of(
                user.getId(),
                user.getUsername(),
                user.getFirstName(),
                user.getLastName(),
                LocalDateTime.now(clock)
        );

        return connection.preparedQuery(sql)
                .execute(params)
                .onSuccess(result -> log.debug("Upserted user {}", user.getId()))
                .onFailure(error -> log.error("Failed to upsert user {}: {}", user.getId(), error.getMessage()))
                .mapEmpty();
    }
}
