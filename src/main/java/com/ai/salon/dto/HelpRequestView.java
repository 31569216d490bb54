package com.ai.salon.dto;

import com.ai.salon.entity.HelpRequest;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

public record HelpRequestView(
        String id,
        String question,
        String answer,
        String status,
        @JsonProperty("room_name") String roomName,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("resolution_notes") String resolutionNotes,
        @JsonProperty("response_time_seconds") Double responseTimeSeconds,
        @JsonProperty("resolved_by") String resolvedBy,
        @JsonProperty("resolved_at") Instant resolvedAt
) {

    public static HelpRequestView from(HelpRequest request) {
        return new HelpRequestView(
                request.getId(),
                request.getQuestion(),
                request.getAnswer(),
                request.getStatus().name().toLowerCase(Locale.ENGLISH),
                request.getRoomName(),
                request.getCreatedAt(),
                request.getUpdatedAt(),
                request.getResolutionNotes(),
                request.getResponseTimeSeconds(),
                request.getResolvedBy(),
                request.getResolvedAt());
    }
}
