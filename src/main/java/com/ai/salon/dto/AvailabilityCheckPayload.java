package com.ai.salon.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Date such as "January 15, 2025" and an optional time such as "2:00 PM".
 */
public record AvailabilityCheckPayload(@NotBlank String date, String time) {
}
