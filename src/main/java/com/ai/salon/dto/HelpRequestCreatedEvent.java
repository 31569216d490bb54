package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Posted to the supervisor webhook when a question is escalated.
 */
public record HelpRequestCreatedEvent(
        String event,
        @JsonProperty("request_id") String requestId,
        String question,
        @JsonProperty("room_name") String roomName,
        @JsonProperty("created_at") String createdAt
) {

    public static final String TYPE = "help_request_created";

    public HelpRequestCreatedEvent(String requestId, String question, String roomName, String createdAt) {
        this(TYPE, requestId, question, roomName, createdAt);
    }
}
