package com.pwescrow.application.service;

import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.QuorumDecision;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Quorum tracker over the escrow log.
 * A joint condition holds once the distinct actors of an acknowledgement cover every required party,
 * so repeated acknowledgements from one party never count twice.
 */
@Slf4j
@RequiredArgsConstructor
public class AgreementReconciler {

    private final EscrowLogRepository logRepository;
    private final Clock clock;

    /**
     * Record {@code actor}'s acknowledgement and decide whether {@code requiredParties} are now all covered.
     * Must run inside the caller's transaction, after the escrow row has been locked.
     */
    public Future<QuorumDecision> contribute(Escrow escrow, String acknowledgement, String actor,
                                             Set<String> requiredParties, JsonObject payload,
                                             SqlConnection connection) {
        ActionLogEntry entry = ActionLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .escrowId(escrow.getId())
                .chatId(escrow.getChatId())
                .actorId(actor)
                .action(acknowledgement)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .build();

        return logRepository.append(entry, connection)
                .compose(v -> logRepository.findDistinctActors(escrow.getId(), acknowledgement, connection))
                .map(actors -> decide(actors, actor, requiredParties))
                .onSuccess(decision -> log.debug("Escrow {} '{}' acknowledged by {}, waiting on {}",
                        escrow.getEscrowCode(), acknowledgement, decision.acknowledgedBy(), decision.waitingOn()));
    }

    private QuorumDecision decide(Set<String> loggedActors, String actor, Set<String> requiredParties) {
        Set<String> acknowledged = new HashSet<>(loggedActors);
        acknowledged.add(actor);

        Set<String> waitingOn = new LinkedHashSet<>(requiredParties);
        waitingOn.removeAll(acknowledged);

        return waitingOn.isEmpty()
                ? QuorumDecision.satisfied(acknowledged)
                : QuorumDecision.pending(acknowledged, waitingOn);
    }
}
