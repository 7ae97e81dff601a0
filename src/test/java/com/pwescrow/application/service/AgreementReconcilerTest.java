package com.pwescrow.application.service;

import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.QuorumDecision;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.SqlConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.pwescrow.support.TestDatabase.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for AgreementReconciler using a mocked log
 */
class AgreementReconcilerTest {

    @Mock
    private EscrowLogRepository logRepository;

    @Mock
    private SqlConnection connection;

    private AgreementReconciler reconciler;
    private AutoCloseable mocks;
    private Escrow escrow;
    private final Set<String> required = new LinkedHashSet<>(List.of("1001", "1002"));

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        reconciler = new AgreementReconciler(logRepository,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        escrow = Escrow.builder()
                .id("escrow-1")
                .escrowCode("PW-100000")
                .chatId("-100")
                .buyerId("1001")
                .sellerId("1002")
                .state(EscrowState.AGREEMENT_PREVIEW)
                .build();

        when(logRepository.append(any(), eq(connection))).thenReturn(Future.succeededFuture());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void contribute_firstPartyIsPendingOnTheOther() throws Exception {
        when(logRepository.findDistinctActors("escrow-1", "agreed", connection))
                .thenReturn(Future.succeededFuture(Set.of()));

        QuorumDecision decision = await(reconciler.contribute(escrow, "agreed", "1001", required,
                new JsonObject().put("action", "agree_buyer"), connection));

        assertFalse(decision.satisfied());
        assertEquals(Set.of("1001"), decision.acknowledgedBy());
        assertEquals(Set.of("1002"), decision.waitingOn());

        ArgumentCaptor<ActionLogEntry> entry = ArgumentCaptor.forClass(ActionLogEntry.class);
        verify(logRepository).append(entry.capture(), eq(connection));
        assertEquals("agreed", entry.getValue().getAction());
        assertEquals("1001", entry.getValue().getActorId());
        assertEquals("escrow-1", entry.getValue().getEscrowId());
    }

    @Test
    void contribute_secondPartySatisfiesTheQuorum() throws Exception {
        when(logRepository.findDistinctActors("escrow-1", "agreed", connection))
                .thenReturn(Future.succeededFuture(Set.of("1001", "1002")));

        QuorumDecision decision = await(reconciler.contribute(escrow, "agreed", "1002", required,
                new JsonObject(), connection));

        assertTrue(decision.satisfied());
        assertTrue(decision.waitingOn().isEmpty());
    }

    @Test
    void contribute_repeatedAcknowledgementFromOnePartyNeverCountsTwice() throws Exception {
        // the log holds the same actor twice; DISTINCT collapses it
        when(logRepository.findDistinctActors("escrow-1", "agreed", connection))
                .thenReturn(Future.succeededFuture(Set.of("1001")));

        QuorumDecision decision = await(reconciler.contribute(escrow, "agreed", "1001", required,
                new JsonObject(), connection));

        assertFalse(decision.satisfied());
        assertEquals(Set.of("1002"), decision.waitingOn());
    }

    @Test
    void contribute_countsTheActorEvenIfTheLogReadMissesIt() throws Exception {
        when(logRepository.findDistinctActors("escrow-1", "agreed", connection))
                .thenReturn(Future.succeededFuture(Set.of("1002")));

        QuorumDecision decision = await(reconciler.contribute(escrow, "agreed", "1001", required,
                new JsonObject(), connection));

        assertTrue(decision.satisfied());
    }

    @Test
    void contribute_propagatesStorageFailure() {
        when(logRepository.append(any(), eq(connection))).thenReturn(Future.failedFuture("disk full"));

        Future<QuorumDecision> result = reconciler.contribute(escrow, "agreed", "1001", required,
                new JsonObject(), connection);

        assertTrue(result.failed());
        assertEquals("disk full", result.cause().getMessage());
    }
}
