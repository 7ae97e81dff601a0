package com.pwescrow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Escrow entity - one buyer/seller deal
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Escrow {
    private String id;                      // UUID, internal only
    private String escrowCode;              // Public code, e.g. PW-100000
    private String chatId;                  // Originating chat
    private String buyerId;                 // Opaque party identity
    private String sellerId;                // Opaque party identity
    private String dealTitle;
    private String description;
    private BigDecimal amount;
    private BigDecimal feeAmount;
    private LocalDateTime deliveryDeadline;
    private String refundConditions;
    private Boolean disputeAgreement;
    private EscrowState state;
    private LocalDateTime createdAt;        // UTC
    private LocalDateTime updatedAt;        // UTC

    public boolean isBuyer(String party) {
        return buyerId != null && buyerId.equals(party);
    }

    public boolean isSeller(String party) {
        return sellerId != null && sellerId.equals(party);
    }

    public boolean isParticipant(String party) {
        return isBuyer(party) || isSeller(party);
    }

    /**
     * Party identity holding the given role; EITHER has no single holder
     */
    public String partyFor(PartyRole role) {
        return switch (role) {
            case BUYER -> buyerId;
            case SELLER -> sellerId;
            case EITHER -> throw new IllegalArgumentException("EITHER does not name a single party");
        };
    }
}
