package com.pwescrow.domain.event;

public enum EscrowEventType {
    ESCROW_CREATED,
    STATE_CHANGED,
    ACTION_DENIED,
    JOINT_CONDITION_PENDING
}
