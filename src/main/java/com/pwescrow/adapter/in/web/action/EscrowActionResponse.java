package com.pwescrow.adapter.in.web.action;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pwescrow.adapter.in.web.dto.OfferView;
import com.pwescrow.application.port.in.EscrowActionUseCase.ActionOutcome;
import com.pwescrow.domain.model.StateChange;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record EscrowActionResponse(
        String status,
        String escrowCode,
        String action,
        String outcome,
        String state,
        List<String> waitingOn,
        List<String> transitions,
        List<OfferView> offers
) {
    public static EscrowActionResponse from(ActionOutcome outcome) {
        List<StateChange> changes = outcome.changes();
        List<OfferView> offers = changes.isEmpty()
                ? List.of()
                : changes.get(changes.size() - 1).offers().stream()
                        .map(offer -> OfferView.from(outcome.escrowCode(), offer))
                        .toList();

        return new EscrowActionResponse(
                "success",
                outcome.escrowCode(),
                outcome.action().getValue(),
                outcome.status().name(),
                outcome.state().getValue(),
                outcome.waitingOn().stream().sorted().toList(),
                changes.stream()
                        .map(change -> change.from().getValue() + "->" + change.to().getValue())
                        .toList(),
                offers
        );
    }
}
