package com.pwescrow.adapter.in.web.dto;

import com.pwescrow.domain.model.ActionOffer;
import com.pwescrow.domain.model.CallbackData;

public record OfferView(
        String action,
        String partyId,
        String token,
        String callbackData
) {
    public static OfferView from(String escrowCode, ActionOffer offer) {
        return new OfferView(offer.action().getValue(), offer.partyId(), offer.token(),
                CallbackData.of(escrowCode, offer).encode());
    }
}
