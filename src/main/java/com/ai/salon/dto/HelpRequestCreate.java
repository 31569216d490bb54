package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record HelpRequestCreate(
        @NotBlank String question,
        @JsonProperty("room_name") String roomName
) {
}
