package com.pwescrow.domain.model;

/**
 * An action exposed to one party, together with the token that authorizes it
 */
public record ActionOffer(EscrowAction action, String partyId, String token) {
}
