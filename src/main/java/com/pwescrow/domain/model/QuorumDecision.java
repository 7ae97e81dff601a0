package com.pwescrow.domain.model;

import java.util.Set;

/**
 * Result of contributing an acknowledgement towards a joint condition
 */
public record QuorumDecision(boolean satisfied, Set<String> acknowledgedBy, Set<String> waitingOn) {

    public static QuorumDecision satisfied(Set<String> acknowledgedBy) {
        return new QuorumDecision(true, Set.copyOf(acknowledgedBy), Set.of());
    }

    public static QuorumDecision pending(Set<String> acknowledgedBy, Set<String> waitingOn) {
        return new QuorumDecision(false, Set.copyOf(acknowledgedBy), Set.copyOf(waitingOn));
    }
}
