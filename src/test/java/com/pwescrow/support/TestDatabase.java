package com.pwescrow.support;

import com.pwescrow.adapter.out.persistence.SchemaInitializer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.jdbcclient.JDBCPool;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Fresh in-memory H2 database in PostgreSQL mode, with the production schema applied
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    public static JDBCPool createPool(Vertx vertx) throws Exception {
        String url = "jdbc:h2:mem:escrow_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH"
                + ";LOCK_TIMEOUT=10000;DB_CLOSE_DELAY=-1";

        JsonObject config = new JsonObject()
                .put("url", url)
                .put("driver_class", "org.h2.Driver")
                .put("user", "sa")
                .put("password", "")
                .put("max_pool_size", 8);

        JDBCPool pool = JDBCPool.pool(vertx, config);
        await(new SchemaInitializer(pool).initialize());
        return pool;
    }

    public static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(15, TimeUnit.SECONDS);
    }

    /**
     * Waits for the future and returns its failure cause; fails the test if it succeeded
     */
    public static Throwable awaitFailure(Future<?> future) throws Exception {
        try {
            Object value = future.toCompletionStage().toCompletableFuture().get(15, TimeUnit.SECONDS);
            return fail("Expected failure but got " + value);
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }
}
