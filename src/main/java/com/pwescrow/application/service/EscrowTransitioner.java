package com.pwescrow.application.service;

import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.exception.InvalidTransitionException;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.StateChange;
import com.pwescrow.domain.model.TransitionGraph;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of escrow state. Checks the graph, compare-and-sets the row,
 * logs a state_change entry and issues the tokens offered on the new state.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowTransitioner {

    private final TransitionGraph graph;
    private final EscrowRepository escrowRepository;
    private final EscrowLogRepository logRepository;
    private final ActionTokenService tokenService;
    private final ActionOfferPolicy offerPolicy;
    private final EscrowSettings settings;
    private final Clock clock;

    /**
     * Move a locked escrow to {@code target} on the caller's transaction.
     * On success the in-memory escrow reflects the new state.
     */
    public Future<StateChange> transition(Escrow escrow, EscrowState target, String actorId, SqlConnection connection) {
        EscrowState from = escrow.getState();
        if (!graph.canTransition(from, target)) {
            log.warn("Rejected transition {} -> {} for escrow {}", from, target, escrow.getEscrowCode());
            return Future.failedFuture(new InvalidTransitionException(from, target));
        }

        LocalDateTime now = LocalDateTime.now(clock);

        return escrowRepository.updateState(escrow.getId(), from, target, now, connection)
                .compose(updated -> {
                    if (!updated) {
                        log.warn("Escrow {} was no longer {} when moving to {}", escrow.getEscrowCode(), from, target);
                        return Future.<Void>failedFuture(new InvalidTransitionException(from, target));
                    }
                    escrow.setState(target);
                    escrow.setUpdatedAt(now);
                    return logRepository.append(stateChangeEntry(escrow, from, target, actorId, now), connection);
                })
                .compose(v -> issueOffers(escrow, target, connection))
                .map(offers -> new StateChange(from, target, offers))
                .onSuccess(change -> log.info("Escrow {} moved {} -> {}", escrow.getEscrowCode(), from, target));
    }

    private Future<List<ActionOffer>> issueOffers(Escrow escrow, EscrowState entered, SqlConnection connection) {
        List<ActionOffer> offers = new ArrayList<>();
        Future<Void> issued = Future.succeededFuture();

        for (ActionOfferPolicy.OfferSpec spec : offerPolicy.offersOn(entered)) {
            String partyId = escrow.partyFor(spec.party());
            issued = issued.compose(v -> tokenService
                    .issue(escrow.getId(), spec.action(), partyId, settings.getActionTokenTtl(), connection)
                    .<Void>map(token -> {
                        offers.add(new ActionOffer(spec.action(), partyId, token.getToken()));
                        return null;
                    }));
        }

        return issued.map(v -> List.copyOf(offers));
    }

    private ActionLogEntry stateChangeEntry(Escrow escrow, EscrowState from, EscrowState to, String actorId,
                                            LocalDateTime now) {
        return ActionLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .escrowId(escrow.getId())
                .chatId(escrow.getChatId())
                .actorId(actorId)
                .action(ActionLogEntry.STATE_CHANGE)
                .payload(new JsonObject().put("from", from.getValue()).put("to", to.getValue()))
                .createdAt(now)
                .build();
    }
}
