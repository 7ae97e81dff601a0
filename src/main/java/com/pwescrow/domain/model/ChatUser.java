package com.pwescrow.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Profile of a chat participant, kept for display only
 */
@Value
@Builder
public class ChatUser {
    String id;
    String username;
    String firstName;
    String lastName;
}
