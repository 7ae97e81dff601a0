package com.pwescrow.domain.model;

import java.util.List;

/**
 * One committed edge of the transition graph plus the offers issued on entering the new state
 */
public record StateChange(EscrowState from, EscrowState to, List<ActionOffer> offers) {
}
