package com.pwescrow.application.service;

import com.pwescrow.domain.model.EscrowAction;
import com.pwescrow.domain.model.EscrowState;
import com.pwescrow.domain.model.PartyRole;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Which actions are offered, and to whom, when an escrow enters a state.
 * One token is issued per entry.
 */
public final class ActionOfferPolicy {

    /**
     * An action offered to the holder of a single role
     */
    public record OfferSpec(EscrowAction action, PartyRole party) {
        public OfferSpec {
            if (party == PartyRole.EITHER) {
                throw new IllegalArgumentException("Offers are issued to one party at a time");
            }
        }
    }

    private final Map<EscrowState, List<OfferSpec>> offers;

    private ActionOfferPolicy(Map<EscrowState, List<OfferSpec>> offers) {
        this.offers = Collections.unmodifiableMap(new EnumMap<>(offers));
    }

    public static ActionOfferPolicy standard() {
        Map<EscrowState, List<OfferSpec>> offers = new EnumMap<>(EscrowState.class);
        offers.put(EscrowState.AGREEMENT_PREVIEW, List.of(
                new OfferSpec(EscrowAction.AGREE_BUYER, PartyRole.BUYER),
                new OfferSpec(EscrowAction.AGREE_SELLER, PartyRole.SELLER),
                new OfferSpec(EscrowAction.DISAGREE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.DISAGREE, PartyRole.SELLER)
        ));
        offers.put(EscrowState.AGREED, List.of(
                new OfferSpec(EscrowAction.PAID_NOTIFY, PartyRole.BUYER),
                new OfferSpec(EscrowAction.DISAGREE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.DISAGREE, PartyRole.SELLER)
        ));
        offers.put(EscrowState.FUNDED, List.of(
                new OfferSpec(EscrowAction.MARK_DELIVERED, PartyRole.SELLER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.SELLER)
        ));
        offers.put(EscrowState.DELIVERED, List.of(
                new OfferSpec(EscrowAction.REQUEST_RELEASE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.SELLER)
        ));
        offers.put(EscrowState.RELEASE_REQUESTED, List.of(
                new OfferSpec(EscrowAction.CONFIRM_RELEASE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.BUYER),
                new OfferSpec(EscrowAction.OPEN_DISPUTE, PartyRole.SELLER)
        ));
        return new ActionOfferPolicy(offers);
    }

    public List<OfferSpec> offersOn(EscrowState entered) {
        return offers.getOrDefault(entered, List.of());
    }
}
