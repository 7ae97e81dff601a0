package com.pwescrow.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Actions a party can request on an escrow.
 * Joint actions only contribute an acknowledgement; the transition fires once every required party has contributed.
 */
public enum EscrowAction {
    AGREE_BUYER("agree_buyer", PartyRole.BUYER, EscrowState.AGREED, true, "agreed", "Agree (Buyer)", null,
            EnumSet.of(EscrowState.AGREEMENT_PREVIEW)),
    AGREE_SELLER("agree_seller", PartyRole.SELLER, EscrowState.AGREED, true, "agreed", "Agree (Seller)", null,
            EnumSet.of(EscrowState.AGREEMENT_PREVIEW)),
    DISAGREE("disagree", PartyRole.EITHER, EscrowState.CANCELLED, false, "disagreed", "Disagree", null,
            EnumSet.of(EscrowState.AGREEMENT_PREVIEW, EscrowState.AGREED)),
    PAID_NOTIFY("paid_notify", PartyRole.BUYER, EscrowState.FUNDED, false, "paid_notified", "I've Paid - Notify", null,
            EnumSet.of(EscrowState.AGREED)),
    MARK_DELIVERED("mark_delivered", PartyRole.SELLER, EscrowState.DELIVERED, false, "delivered", "Mark Delivered", null,
            EnumSet.of(EscrowState.FUNDED)),
    REQUEST_RELEASE("request_release", PartyRole.BUYER, EscrowState.RELEASE_REQUESTED, false, "release_requested", "Release Funds", null,
            EnumSet.of(EscrowState.DELIVERED)),
    CONFIRM_RELEASE("confirm_release", PartyRole.BUYER, EscrowState.RELEASE_CONFIRMED, false, "release_confirmed", "Yes, Release", EscrowState.COMPLETED,
            EnumSet.of(EscrowState.RELEASE_REQUESTED)),
    OPEN_DISPUTE("open_dispute", PartyRole.EITHER, EscrowState.DISPUTED, false, "dispute_opened", "Open Dispute", null,
            EnumSet.of(EscrowState.FUNDED, EscrowState.DELIVERED, EscrowState.RELEASE_REQUESTED));

    private final String value;
    private final PartyRole role;
    private final EscrowState target;
    private final boolean joint;
    private final String logAction;
    private final String label;
    private final EscrowState followUp;
    private final Set<EscrowState> availableFrom;

    EscrowAction(String value, PartyRole role, EscrowState target, boolean joint,
                 String logAction, String label, EscrowState followUp, EnumSet<EscrowState> availableFrom) {
        this.value = value;
        this.role = role;
        this.target = target;
        this.joint = joint;
        this.logAction = logAction;
        this.label = label;
        this.followUp = followUp;
        this.availableFrom = Collections.unmodifiableSet(availableFrom);
    }

    public String getValue() {
        return value;
    }

    public PartyRole getRole() {
        return role;
    }

    public EscrowState getTarget() {
        return target;
    }

    public boolean isJoint() {
        return joint;
    }

    /**
     * Action name written to the escrow log when this action is performed
     */
    public String getLogAction() {
        return logAction;
    }

    public String getLabel() {
        return label;
    }

    /**
     * State entered immediately after the target within the same unit of work, if any
     */
    public Optional<EscrowState> getFollowUp() {
        return Optional.ofNullable(followUp);
    }

    /**
     * States in which this action may be performed. Narrower than the graph: DISAGREE leads to
     * CANCELLED but is only accepted while the deal is still being agreed.
     */
    public Set<EscrowState> getAvailableFrom() {
        return availableFrom;
    }

    public boolean isAvailableFrom(EscrowState state) {
        return availableFrom.contains(state);
    }

    public static EscrowAction fromValue(String value) {
        for (EscrowAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown escrow action: " + value);
    }

    public static boolean isValid(String value) {
        for (EscrowAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
