package com.ai.salon.conversation;

import java.time.Instant;

public record AvailabilityCheck(String date, String time, Instant timestamp) {
}
