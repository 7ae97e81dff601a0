package com.pwescrow.application.service;

import com.pwescrow.application.port.in.EscrowFormUseCase;
import com.pwescrow.application.port.out.EscrowEventPublisher;
import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.application.port.out.UserRepository;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.domain.exception.EscrowException;
import com.pwescrow.domain.exception.StorageFailureException;
import com.pwescrow.domain.model.ActionLogEntry;
import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.Escrow;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.StateChange;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Application service opening escrows from submitted forms.
 * Creation, the walk to AGREEMENT_PREVIEW and the preview tokens are one transaction.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowFormService implements EscrowFormUseCase {

    private final Pool pool;
    private final EscrowFormValidator validator;
    private final EscrowRepository escrowRepository;
    private final EscrowLogRepository logRepository;
    private final UserRepository userRepository;
    private final EscrowTransitioner transitioner;
    private final EscrowEventPublisher eventPublisher;
    private final EscrowSettings settings;
    private final Clock clock;

    @Override
    public Future<FormOutcome> submitForm(EscrowFormCommand command) {
        log.info("Processing escrow form in chat {} from {}", command.chatId(), creatorId(command));

        // Step 0: Validate
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Escrow form rejected: {}", validation.errors());
            return Future.failedFuture(new FormValidationException(validation.errors()));
        }

        Escrow escrow = convertToDomain(command);

        return pool.withTransaction(connection -> executeFormSteps(connection, escrow, command))
                .recover(error -> Future.failedFuture(error instanceof EscrowException
                        ? error
                        : new StorageFailureException(error)))
                .onSuccess(events -> eventPublisher.publishAll(events))
                .onSuccess(events -> log.info("Escrow {} opened for {} (fee {})",
                        escrow.getEscrowCode(), escrow.getAmount(), escrow.getFeeAmount()))
                .onFailure(error -> log.error("Failed to open escrow from chat {}: {}",
                        command.chatId(), error.getMessage(), error))
                .map(events -> new FormOutcome(escrow.getEscrowCode(), escrow.getState(), escrow.getAmount(),
                        escrow.getFeeAmount(), offersOf(events)));
    }

    private Future<List<EscrowEvent>> executeFormSteps(SqlConnection connection, Escrow escrow, EscrowFormCommand command) {
        String actor = creatorId(command);
        List<EscrowEvent> events = new ArrayList<>();

        // Step 1: Remember who submitted the form
        return userRepository.upsert(command.creator(), connection)
                // Step 2: Allocate the public code and insert in CREATED
                .compose(v -> escrowRepository.nextEscrowCode(settings.getCodePrefix(), connection))
                .compose(code -> {
                    escrow.setEscrowCode(code);
                    return escrowRepository.insert(escrow, connection);
                })
                .compose(v -> logRepository.append(entry(escrow, actor, ActionLogEntry.CREATED,
                        new JsonObject().put("code", escrow.getEscrowCode())), connection))
                .map(v -> events.add(EscrowEvent.created(escrow.getEscrowCode(), escrow.getChatId(),
                        escrow.getAmount(), actor)))
                // Step 3: CREATED -> FORM_SUBMITTED
                .compose(v -> transitioner.transition(escrow, EscrowState.FORM_SUBMITTED, actor, connection))
                .compose(change -> {
                    events.add(stateChanged(escrow, change, actor));
                    return logRepository.append(entry(escrow, actor, ActionLogEntry.FORM_SUBMITTED,
                            formPayload(escrow, command)), connection);
                })
                // Step 4: FORM_SUBMITTED -> AGREEMENT_PREVIEW, issuing the per-party tokens
                .compose(v -> transitioner.transition(escrow, EscrowState.AGREEMENT_PREVIEW, actor, connection))
                .compose(change -> {
                    events.add(stateChanged(escrow, change, actor));
                    return logRepository.append(entry(escrow, actor, ActionLogEntry.AGREEMENT_PREVIEW_SENT,
                            new JsonObject().put("offers", change.offers().size())), connection);
                })
                .map(v -> List.copyOf(events));
    }

    private Escrow convertToDomain(EscrowFormCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal amount = EscrowFormValidator.parseAmount(command.amount());
        int deliveryHours = command.delivery() == null || command.delivery().isBlank()
                ? settings.getDefaultDeliveryHours()
                : EscrowFormValidator.parseDeliveryHours(command.delivery()).orElse(settings.getDefaultDeliveryHours());
        Boolean dispute = command.disputeAgreement() == null || command.disputeAgreement().isBlank()
                ? Boolean.FALSE
                : EscrowFormValidator.parseYesNo(command.disputeAgreement());

        return Escrow.builder()
                .id(UUID.randomUUID().toString())
                .chatId(command.chatId())
                .buyerId(command.buyer().trim())
                .sellerId(command.seller().trim())
                .dealTitle(command.dealTitle().trim())
                .description(command.description())
                .amount(amount)
                .feeAmount(settings.feeFor(amount))
                .deliveryDeadline(now.plusHours(deliveryHours))
                .refundConditions(command.refundConditions())
                .disputeAgreement(dispute)
                .state(EscrowState.initial())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private JsonObject formPayload(Escrow escrow, EscrowFormCommand command) {
        return new JsonObject()
                .put("buyer_field", command.buyer())
                .put("seller_field", command.seller())
                .put("amount", escrow.getAmount().toPlainString())
                .put("fee", escrow.getFeeAmount().toPlainString())
                .put("title", escrow.getDealTitle());
    }

    private ActionLogEntry entry(Escrow escrow, String actor, String action, JsonObject payload) {
        return ActionLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .escrowId(escrow.getId())
                .chatId(escrow.getChatId())
                .actorId(actor)
                .action(action)
                .payload(payload)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private EscrowEvent stateChanged(Escrow escrow, StateChange change, String actor) {
        return EscrowEvent.stateChanged(escrow.getEscrowCode(), escrow.getChatId(), change.from(), change.to(),
                escrow.getAmount(), actor, change.offers());
    }

    private List<ActionOffer> offersOf(List<EscrowEvent> events) {
        return events.stream()
                .flatMap(event -> event.getOffers().stream())
                .toList();
    }

    private String creatorId(EscrowFormCommand command) {
        return command.creator() == null ? "unknown" : command.creator().getId();
    }
}
