package com.ai.salon.conversation;

import java.time.Instant;

public record QueryRecord(String query, Instant timestamp) {
}
