package com.pwescrow.adapter.out.persistence;

import io.vertx.core.Future;
import io.vertx.sqlclient.SqlClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies schema.sql from the classpath, one statement at a time
 */
@Slf4j
public class SchemaInitializer {

    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final SqlClient sqlClient;

    public SchemaInitializer(SqlClient sqlClient) {
        this.sqlClient = sqlClient;
    }

    public Future<Void> initialize() {
        List<String> statements;
        try {
            statements = loadStatements();
        } catch (UncheckedIOException e) {
            return Future.failedFuture(e);
        }

        Future<Void> future = Future.succeededFuture();
        for (String statement : statements) {
            future = future.compose(v -> sqlClient.query(statement).execute().mapEmpty());
        }

        return future
                .onSuccess(v -> log.info("Database schema ready ({} statements)", statements.size()))
                .onFailure(error -> log.error("Failed to apply database schema", error));
    }

    static List<String> splitStatements(String script) {
        String withoutComments = Arrays.stream(script.split("\\R"))
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));

        List<String> statements = new ArrayList<>();
        for (String statement : withoutComments.split(";")) {
            if (!statement.isBlank()) {
                statements.add(statement.trim());
            }
        }
        return statements;
    }

    private List<String> loadStatements() {
        try (InputStream is = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new UncheckedIOException(new IOException(SCHEMA_RESOURCE + " not found in classpath"));
            }
            return splitStatements(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
