package com.pwescrow.adapter.out.persistence;

import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.ChatUser;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.support.MutableClock;
import com.pwescrow.support.TestDatabase;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.pwescrow.support.TestDatabase.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * JDBC adapters against H2 in PostgreSQL mode
 */
class JdbcPersistenceAdapterTest {

    private Vertx vertx;
    private JDBCPool pool;
    private MutableClock clock;
    private JdbcEscrowPersistenceAdapter escrows;
    private JdbcEscrowLogPersistenceAdapter logs;
    private JdbcUserPersistenceAdapter users;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        pool = TestDatabase.createPool(vertx);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        escrows = new JdbcEscrowPersistenceAdapter(pool);
        logs = new JdbcEscrowLogPersistenceAdapter(pool);
        users = new JdbcUserPersistenceAdapter(clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    private Escrow newEscrow(String id, String code) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Escrow.builder()
                .id(id)
                .escrowCode(code)
                .chatId("-100")
                .buyerId("1001")
                .sellerId("1002")
                .dealTitle("Domain name")
                .description("example.in")
                .amount(new BigDecimal("1500.00"))
                .feeAmount(new BigDecimal("90.00"))
                .deliveryDeadline(now.plusHours(48))
                .refundConditions("Full refund before transfer")
                .disputeAgreement(false)
                .state(EscrowState.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void escrow_insertAndFindRoundTripsEveryColumn() throws Exception {
        Escrow escrow = newEscrow("e-1", "PW-100000");
        await(pool.withTransaction(conn -> escrows.insert(escrow, conn)));

        Optional<Escrow> found = await(escrows.findByCode("PW-100000"));

        assertTrue(found.isPresent());
        assertEquals(escrow, found.get());
        assertTrue(await(escrows.findByCode("PW-404")).isEmpty());
    }

    @Test
    void escrow_codesComeFromTheSequence() throws Exception {
        String first = await(pool.withTransaction(conn -> escrows.nextEscrowCode("PW-", conn)));
        String second = await(pool.withTransaction(conn -> escrows.nextEscrowCode("PW-", conn)));

        assertEquals("PW-100000", first);
        assertEquals("PW-100001", second);
    }

    @Test
    void escrow_updateStateIsACompareAndSet() throws Exception {
        await(pool.withTransaction(conn -> escrows.insert(newEscrow("e-1", "PW-100000"), conn)));
        LocalDateTime later = LocalDateTime.now(clock).plusMinutes(5);

        boolean first = await(pool.withTransaction(conn ->
                escrows.updateState("e-1", EscrowState.CREATED, EscrowState.FORM_SUBMITTED, later, conn)));
        boolean stale = await(pool.withTransaction(conn ->
                escrows.updateState("e-1", EscrowState.CREATED, EscrowState.CANCELLED, later, conn)));

        assertTrue(first);
        assertFalse(stale);
        Escrow reloaded = await(escrows.findByCode("PW-100000")).orElseThrow();
        assertEquals(EscrowState.FORM_SUBMITTED, reloaded.getState());
        assertEquals(later, reloaded.getUpdatedAt());
    }

    @Test
    void log_keepsInsertionOrderAndDistinctActors() throws Exception {
        await(pool.withTransaction(conn -> escrows.insert(newEscrow("e-1", "PW-100000"), conn)));
        List<ActionLogEntry> entries = List.of(
                entry("l-3", "1001", "agreed", new JsonObject().put("action", "agree_buyer")),
                entry("l-1", "1001", "agreed", new JsonObject().put("action", "agree_buyer")),
                entry("l-2", "1002", "disagreed", null));
        for (ActionLogEntry entry : entries) {
            await(pool.withTransaction(conn -> logs.append(entry, conn)));
        }

        List<ActionLogEntry> read = await(logs.findByEscrow("e-1"));
        Set<String> agreed = await(pool.withTransaction(conn -> logs.findDistinctActors("e-1", "agreed", conn)));

        assertEquals(List.of("l-3", "l-1", "l-2"), read.stream().map(ActionLogEntry::getId).toList());
        assertEquals("agree_buyer", read.get(0).getPayload().getString("action"));
        assertTrue(read.get(2).getPayload().isEmpty());
        assertEquals(Set.of("1001"), agreed);
    }

    @Test
    void user_upsertInsertsThenUpdatesProfile() throws Exception {
        await(pool.withTransaction(conn -> users.upsert(
                ChatUser.builder().id("1001").username("asha").firstName("Asha").build(), conn)));
        await(pool.withTransaction(conn -> users.upsert(
                ChatUser.builder().id("1001").username("asha_k").firstName("Asha").lastName("K").build(), conn)));

        RowSet<Row> rows = await(pool.preparedQuery("SELECT username, last_name FROM users WHERE id = ?")
                .execute(Tuple.of("1001")));

        assertEquals(1, rows.size());
        Row row = rows.iterator().next();
        assertEquals("asha_k", row.getString("username"));
        assertEquals("K", row.getString("last_name"));
    }

    @Test
    void schema_splitsStatementsAndDropsComments() {
        List<String> statements = SchemaInitializer.splitStatements(
                "-- header\nCREATE TABLE a (id INT);\n\n-- second\nCREATE TABLE b (id INT);\n");

        assertEquals(List.of("CREATE TABLE a (id INT)", "CREATE TABLE b (id INT)"), statements);
    }

    private ActionLogEntry entry(String id, String actor, String action, JsonObject payload) {
        return ActionLogEntry.builder()
                .id(id)
                .escrowId("e-1")
                .chatId("-100")
                .actorId(actor)
                .action(action)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }
}
