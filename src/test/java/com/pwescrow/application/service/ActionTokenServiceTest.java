package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowFormUseCase.FormOutcome;
import com.pwescrow.domain.exception.TokenDeniedException;
import com.pwescrow.domain.model.ActionToken;
import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.TokenDenialReason;
import com.pwescrow.support.EscrowTestEngine;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.pwescrow.support.EscrowTestEngine.BUYER;
import static com.pwescrow.support.EscrowTestEngine.SELLER;
import static com.pwescrow.support.TestDatabase.await;
import static com.pwescrow.support.TestDatabase.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionTokenService against H2
 */
class ActionTokenServiceTest {

    private EscrowTestEngine engine;
    private String escrowId;

    @BeforeEach
    void setUp() throws Exception {
        engine = new EscrowTestEngine();
        FormOutcome outcome = engine.openEscrow();
        escrowId = engine.load(outcome.escrowCode()).getId();
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
    }

    private ActionToken issue(EscrowAction action, String party, Duration ttl) throws Exception {
        return await(engine.pool.withTransaction(conn -> engine.tokenService.issue(escrowId, action, party, ttl, conn)));
    }

    private Future<ActionToken> consume(String token, EscrowAction action, String party) {
        return engine.pool.withTransaction(conn -> engine.tokenService.consume(token, escrowId, action, party, conn));
    }

    private TokenDenialReason denialOf(Future<?> future) throws Exception {
        Throwable error = awaitFailure(future);
        assertInstanceOf(TokenDeniedException.class, error);
        return ((TokenDeniedException) error).getDenialReason();
    }

    @Test
    void issue_createsUnusedTokenBoundToParty() throws Exception {
        ActionToken token = issue(EscrowAction.MARK_DELIVERED, SELLER, Duration.ofMinutes(15));

        assertFalse(token.isUsed());
        assertEquals(SELLER, token.getPartyId());
        assertEquals(token.getCreatedAt().plusMinutes(15), token.getExpiresAt());
        assertFalse(engine.isTokenUsed(token.getToken()));
    }

    @Test
    void consume_succeedsOnceThenReportsAlreadyUsed() throws Exception {
        ActionToken token = issue(EscrowAction.PAID_NOTIFY, BUYER, Duration.ofMinutes(15));

        ActionToken consumed = await(consume(token.getToken(), EscrowAction.PAID_NOTIFY, BUYER));

        assertEquals(token.getToken(), consumed.getToken());
        assertTrue(engine.isTokenUsed(token.getToken()));
        assertEquals(TokenDenialReason.ALREADY_USED, denialOf(consume(token.getToken(), EscrowAction.PAID_NOTIFY, BUYER)));
    }

    @Test
    void consume_unknownOrMismatchedTokenIsInvalid() throws Exception {
        ActionToken token = issue(EscrowAction.PAID_NOTIFY, BUYER, Duration.ofMinutes(15));

        assertEquals(TokenDenialReason.INVALID_TOKEN, denialOf(consume("no-such-token", EscrowAction.PAID_NOTIFY, BUYER)));
        assertEquals(TokenDenialReason.INVALID_TOKEN, denialOf(consume(token.getToken(), EscrowAction.DISAGREE, BUYER)));
        assertEquals(TokenDenialReason.INVALID_TOKEN, denialOf(consume("", EscrowAction.PAID_NOTIFY, BUYER)));
        assertEquals(TokenDenialReason.INVALID_TOKEN, denialOf(consume(null, EscrowAction.PAID_NOTIFY, BUYER)));
        assertFalse(engine.isTokenUsed(token.getToken()));
    }

    @Test
    void consume_tokenOfAnotherPartyIsWrongUserAndStaysUnused() throws Exception {
        ActionToken token = issue(EscrowAction.AGREE_BUYER, BUYER, Duration.ofMinutes(15));

        assertEquals(TokenDenialReason.WRONG_USER, denialOf(consume(token.getToken(), EscrowAction.AGREE_BUYER, SELLER)));
        assertFalse(engine.isTokenUsed(token.getToken()));

        await(consume(token.getToken(), EscrowAction.AGREE_BUYER, BUYER));
    }

    @Test
    void consume_expiredTokenIsDenied() throws Exception {
        ActionToken token = issue(EscrowAction.PAID_NOTIFY, BUYER, Duration.ofMinutes(15));

        engine.clock.advance(Duration.ofMinutes(15));

        assertEquals(TokenDenialReason.EXPIRED, denialOf(consume(token.getToken(), EscrowAction.PAID_NOTIFY, BUYER)));
        assertFalse(engine.isTokenUsed(token.getToken()));
    }

    @Test
    void consume_checksUsedBeforePartyAndExpiry() throws Exception {
        ActionToken token = issue(EscrowAction.PAID_NOTIFY, BUYER, Duration.ofMinutes(15));
        await(consume(token.getToken(), EscrowAction.PAID_NOTIFY, BUYER));
        engine.clock.advance(Duration.ofHours(1));

        assertEquals(TokenDenialReason.ALREADY_USED, denialOf(consume(token.getToken(), EscrowAction.PAID_NOTIFY, SELLER)));
    }

    @Test
    void consume_concurrentAttemptsOnOneTokenSucceedExactlyOnce() throws Exception {
        ActionToken token = issue(EscrowAction.PAID_NOTIFY, BUYER, Duration.ofMinutes(15));

        List<Future<ActionToken>> attempts = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            attempts.add(consume(token.getToken(), EscrowAction.PAID_NOTIFY, BUYER));
        }
        await(Future.join(new ArrayList<>(attempts)).otherwiseEmpty());

        long succeeded = attempts.stream().filter(Future::succeeded).count();
        assertEquals(1, succeeded);
        for (Future<ActionToken> attempt : attempts) {
            if (attempt.failed()) {
                assertEquals(TokenDenialReason.ALREADY_USED,
                        ((TokenDeniedException) attempt.cause()).getDenialReason());
            }
        }
    }
}
