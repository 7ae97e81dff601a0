package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowActionUseCase;
import com.pwescrow.application.port.out.EscrowEventPublisher;
import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.exception.EscrowException;
import com.pwescrow.domain.exception.EscrowNotFoundException;
import com.pwescrow.domain.exception.InvalidTransitionException;
import com.pwescrow.domain.exception.StorageFailureException;
import com.pwescrow.domain.exception.UnauthorizedActionException;
import com.pwescrow.domain.exception.UnknownActionException;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.StateChange;
import com.pwescrow.domain.model.TransitionGraph;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Application service driving escrows through their lifecycle in response to party actions.
 * Every request is one transaction: lock escrow, consume token, check role, check graph, write.
 * Events are published only once that transaction has committed.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowLifecycleService implements EscrowActionUseCase {

    private final Pool pool;
    private final EscrowRepository escrowRepository;
    private final EscrowLogRepository logRepository;
    private final ActionTokenService tokenService;
    private final AgreementReconciler reconciler;
    private final EscrowTransitioner transitioner;
    private final TransitionGraph graph;
    private final EscrowEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public Future<ActionOutcome> performAction(ActionCommand command) {
        log.info("Action {} on escrow {} by {}", command.action(), command.escrowCode(), command.requestingParty());

        if (!EscrowAction.isValid(command.action())) {
            UnknownActionException denial = new UnknownActionException(command.action());
            publishDenial(command, denial);
            return Future.failedFuture(denial);
        }
        EscrowAction action = EscrowAction.fromValue(command.action());

        return pool.withTransaction(connection -> executeActionSteps(connection, action, command))
                .recover(error -> Future.failedFuture(toDomainFailure(error)))
                .onSuccess(result -> eventPublisher.publishAll(result.events()))
                .onSuccess(result -> log.info("Action {} on escrow {} committed: {} ({})",
                        action.getValue(), command.escrowCode(), result.outcome().status(), result.outcome().state()))
                .onFailure(error -> publishDenial(command, error))
                .map(UnitResult::outcome);
    }

    private Future<UnitResult> executeActionSteps(SqlConnection connection, EscrowAction action, ActionCommand command) {
        String party = command.requestingParty();

        // Step 1: Lock the escrow row
        return escrowRepository.findByCodeForUpdate(command.escrowCode(), connection)
                .compose(found -> found
                        .map(Future::succeededFuture)
                        .orElseGet(() -> Future.<Escrow>failedFuture(new EscrowNotFoundException(command.escrowCode()))))
                .compose(escrow -> {
                    // Step 2: Consume the token
                    return tokenService.consume(command.token(), escrow.getId(), action, party, connection)
                            .map(escrow);
                })
                .compose(escrow -> {
                    // Step 3: Role gate
                    if (!action.getRole().admits(escrow, party)) {
                        log.warn("Party {} is not {} on escrow {}", party, action.getRole(), escrow.getEscrowCode());
                        return Future.<UnitResult>failedFuture(new UnauthorizedActionException(action.getRole()));
                    }
                    // The action must belong to the current state and its target must be reachable
                    if (!action.isAvailableFrom(escrow.getState())
                            || !graph.canTransition(escrow.getState(), action.getTarget())) {
                        log.warn("Action {} not available on escrow {} in state {}",
                                action.getValue(), escrow.getEscrowCode(), escrow.getState());
                        return Future.<UnitResult>failedFuture(new InvalidTransitionException(escrow.getState(), action.getTarget()));
                    }

                    // Steps 4 & 5
                    return action.isJoint()
                            ? applyJointAction(escrow, action, party, connection)
                            : applyPlainAction(escrow, action, party, connection);
                });
    }

    // Step 4: plain transition, optionally followed by an automatic second edge
    private Future<UnitResult> applyPlainAction(Escrow escrow, EscrowAction action, String party, SqlConnection connection) {
        List<StateChange> changes = new ArrayList<>();

        Future<Void> applied = logRepository.append(actionEntry(escrow, action, party), connection)
                .compose(v -> transitioner.transition(escrow, action.getTarget(), party, connection))
                .<Void>map(change -> {
                    changes.add(change);
                    return null;
                });

        if (action.getFollowUp().isPresent()) {
            applied = applied.compose(v -> transitioner.transition(escrow, action.getFollowUp().get(), party, connection))
                    .<Void>map(change -> {
                        changes.add(change);
                        return null;
                    });
        }

        return applied.map(v -> transitioned(escrow, action, party, changes));
    }

    // Step 5: joint condition contributor
    private Future<UnitResult> applyJointAction(Escrow escrow, EscrowAction action, String party, SqlConnection connection) {
        Set<String> required = new LinkedHashSet<>(List.of(escrow.getBuyerId(), escrow.getSellerId()));
        JsonObject payload = new JsonObject().put("action", action.getValue());

        return reconciler.contribute(escrow, action.getLogAction(), party, required, payload, connection)
                .compose(decision -> {
                    if (!decision.satisfied()) {
                        ActionOutcome outcome = new ActionOutcome(escrow.getEscrowCode(), action,
                                OutcomeStatus.PENDING, escrow.getState(), decision.waitingOn(), List.of());
                        EscrowEvent pending = EscrowEvent.pending(escrow.getEscrowCode(), escrow.getChatId(),
                                party, decision.waitingOn());
                        return Future.succeededFuture(new UnitResult(outcome, List.of(pending)));
                    }
                    return transitioner.transition(escrow, action.getTarget(), party, connection)
                            .map(change -> transitioned(escrow, action, party, List.of(change)));
                });
    }

    private UnitResult transitioned(Escrow escrow, EscrowAction action, String party, List<StateChange> changes) {
        List<EscrowEvent> events = new ArrayList<>();
        for (StateChange change : changes) {
            events.add(EscrowEvent.stateChanged(escrow.getEscrowCode(), escrow.getChatId(),
                    change.from(), change.to(), escrow.getAmount(), party, change.offers()));
        }
        ActionOutcome outcome = new ActionOutcome(escrow.getEscrowCode(), action,
                OutcomeStatus.TRANSITIONED, escrow.getState(), Set.of(), List.copyOf(changes));
        return new UnitResult(outcome, events);
    }

    private ActionLogEntry actionEntry(Escrow escrow, EscrowAction action, String party) {
        return ActionLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .escrowId(escrow.getId())
                .chatId(escrow.getChatId())
                .actorId(party)
                .action(action.getLogAction())
                .payload(new JsonObject().put("action", action.getValue()).put("by", party))
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private EscrowException toDomainFailure(Throwable error) {
        if (error instanceof EscrowException escrowException) {
            return escrowException;
        }
        log.error("Unit of work failed and was rolled back", error);
        return new StorageFailureException(error);
    }

    private void publishDenial(ActionCommand command, Throwable error) {
        if (error instanceof EscrowException denial && !(denial instanceof StorageFailureException)) {
            log.warn("Action {} on escrow {} denied: {}", command.action(), command.escrowCode(), denial.getReason());
            eventPublisher.publish(EscrowEvent.denied(command.escrowCode(), null,
                    command.requestingParty(), denial.getReason()));
        }
    }

    private record UnitResult(ActionOutcome outcome, List<EscrowEvent> events) {}
}
