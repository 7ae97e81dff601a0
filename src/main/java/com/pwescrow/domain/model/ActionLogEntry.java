package com.pwescrow.domain.model;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Immutable audit record of something that happened to an escrow
 */
@Value
@Builder
public class ActionLogEntry {
    public static final String CREATED = "created";
    public static final String FORM_SUBMITTED = "form_submitted";
    public static final String AGREEMENT_PREVIEW_SENT = "agreement_preview_sent";
    public static final String STATE_CHANGE = "state_change";

    String id;
    String escrowId;
    String chatId;
    String actorId;
    String action;
    JsonObject payload;
    LocalDateTime createdAt;
}
