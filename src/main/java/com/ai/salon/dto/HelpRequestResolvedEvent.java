package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Posted to the agent callback so the conversation can relay the supervisor's answer.
 */
public record HelpRequestResolvedEvent(
        String event,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("room_name") String roomName,
        @JsonProperty("original_question") String originalQuestion,
        String answer
) {

    public static final String TYPE = "help_request_resolved";

    public HelpRequestResolvedEvent(String requestId, String roomName, String originalQuestion, String answer) {
        this(TYPE, requestId, roomName, originalQuestion, answer);
    }
}
