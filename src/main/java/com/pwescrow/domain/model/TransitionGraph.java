package com.pwescrow.domain.model;

import com.pwescrow.domain.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable adjacency table of legal escrow state transitions.
 * Built once at startup and handed to every component that writes state.
 */
public final class TransitionGraph {

    private final Map<EscrowState, Set<EscrowState>> edges;

    private TransitionGraph(Map<EscrowState, Set<EscrowState>> edges) {
        EnumMap<EscrowState, Set<EscrowState>> copy = new EnumMap<>(EscrowState.class);
        for (EscrowState state : EscrowState.values()) {
            Set<EscrowState> targets = edges.get(state);
            copy.put(state, targets == null || targets.isEmpty()
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(EnumSet.copyOf(targets)));
        }
        this.edges = Collections.unmodifiableMap(copy);
    }

    /**
     * The escrow lifecycle graph. COMPLETED, CANCELLED and EXPIRED have no outgoing edges.
     */
    public static TransitionGraph standard() {
        Map<EscrowState, Set<EscrowState>> edges = new EnumMap<>(EscrowState.class);
        edges.put(EscrowState.CREATED, EnumSet.of(EscrowState.FORM_SUBMITTED, EscrowState.CANCELLED));
        edges.put(EscrowState.FORM_SUBMITTED, EnumSet.of(EscrowState.AGREEMENT_PREVIEW, EscrowState.CANCELLED));
        edges.put(EscrowState.AGREEMENT_PREVIEW, EnumSet.of(EscrowState.AGREED, EscrowState.CANCELLED));
        edges.put(EscrowState.AGREED, EnumSet.of(EscrowState.FUNDED, EscrowState.CANCELLED));
        edges.put(EscrowState.FUNDED, EnumSet.of(EscrowState.DELIVERED, EscrowState.DISPUTED, EscrowState.CANCELLED));
        edges.put(EscrowState.DELIVERED, EnumSet.of(EscrowState.RELEASE_REQUESTED, EscrowState.DISPUTED));
        edges.put(EscrowState.RELEASE_REQUESTED, EnumSet.of(EscrowState.RELEASE_CONFIRMED, EscrowState.DISPUTED));
        edges.put(EscrowState.RELEASE_CONFIRMED, EnumSet.of(EscrowState.COMPLETED));
        edges.put(EscrowState.DISPUTED, EnumSet.of(EscrowState.RELEASE_CONFIRMED, EscrowState.CANCELLED));
        return new TransitionGraph(edges);
    }

    public boolean canTransition(EscrowState from, EscrowState to) {
        return edges.get(from).contains(to);
    }

    /**
     * @throws InvalidTransitionException if {@code from -> to} is not an edge of the graph
     */
    public void requireTransition(EscrowState from, EscrowState to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
    }

    public Set<EscrowState> targetsOf(EscrowState from) {
        return edges.get(from);
    }

    public boolean isTerminal(EscrowState state) {
        return edges.get(state).isEmpty();
    }
}
