package com.pwescrow.application.service;

import com.pwescrow.application.port.out.ActionTokenRepository;
import com.pwescrow.domain.exception.TokenDeniedException;
import com.pwescrow.domain.model.ActionToken;
import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.TokenDenialReason;
import io.vertx.core.Future;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Issues and single-consumes action tokens.
 * Both operations run on the caller's connection so they share its transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class ActionTokenService {

    private final ActionTokenRepository tokenRepository;
    private final Clock clock;

    /**
     * Create a fresh token for exactly this (escrow, action, party) triple.
     * Earlier tokens for the same role stay valid until they expire or are used.
     */
    public Future<ActionToken> issue(String escrowId, EscrowAction action, String partyId, Duration ttl,
                                     SqlConnection connection) {
        LocalDateTime now = LocalDateTime.now(clock);
        ActionToken token = ActionToken.builder()
                .token(UUID.randomUUID().toString())
                .escrowId(escrowId)
                .action(action)
                .partyId(partyId)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .used(false)
                .build();

        return tokenRepository.save(token, connection)
                .onSuccess(v -> log.debug("Issued {} token for escrow {} expiring at {}",
                        action.getValue(), escrowId, token.getExpiresAt()))
                .map(token);
    }

    /**
     * Validate and mark the token used. Checks run in a fixed order:
     * existence for (escrow, action), not used, bound party, expiry.
     * @return Future with the consumed token, or failed with {@link TokenDeniedException}
     */
    public Future<ActionToken> consume(String token, String escrowId, EscrowAction action, String requestingParty,
                                       SqlConnection connection) {
        if (token == null || token.isBlank()) {
            return deny(TokenDenialReason.INVALID_TOKEN);
        }

        return tokenRepository.findForUpdate(token, escrowId, action, connection)
                .compose(found -> {
                    if (found.isEmpty()) {
                        return deny(TokenDenialReason.INVALID_TOKEN);
                    }
                    ActionToken actionToken = found.get();
                    if (actionToken.isUsed()) {
                        return deny(TokenDenialReason.ALREADY_USED);
                    }
                    if (!actionToken.getPartyId().equals(requestingParty)) {
                        return deny(TokenDenialReason.WRONG_USER);
                    }
                    if (actionToken.isExpiredAt(LocalDateTime.now(clock))) {
                        return deny(TokenDenialReason.EXPIRED);
                    }

                    // Conditional update; a concurrent consumer that slipped past the row lock gets zero rows
                    return tokenRepository.markUsed(token, connection)
                            .compose(flipped -> flipped
                                    ? Future.succeededFuture(actionToken)
                                    : deny(TokenDenialReason.ALREADY_USED));
                });
    }

    private Future<ActionToken> deny(TokenDenialReason reason) {
        log.debug("Token denied: {}", reason.getValue());
        return Future.failedFuture(new TokenDeniedException(reason));
    }
}
