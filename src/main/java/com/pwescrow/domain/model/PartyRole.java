package com.pwescrow.domain.model;

/**
 * Which side of the deal may perform an action
 */
public enum PartyRole {
    BUYER("Buyer"),
    SELLER("Seller"),
    EITHER("Buyer or Seller");

    private final String label;

    PartyRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean admits(Escrow escrow, String party) {
        return switch (this) {
            case BUYER -> escrow.isBuyer(party);
            case SELLER -> escrow.isSeller(party);
            case EITHER -> escrow.isParticipant(party);
        };
    }
}
