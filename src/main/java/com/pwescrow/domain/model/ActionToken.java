package com.pwescrow.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Single-use capability binding one party to one action on one escrow
 */
@Value
@Builder
public class ActionToken {
    String token;               // Random UUID, never reissued
    String escrowId;
    EscrowAction action;
    String partyId;             // Only this party may consume the token
    LocalDateTime createdAt;
    LocalDateTime expiresAt;
    boolean used;

    public boolean isExpiredAt(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
