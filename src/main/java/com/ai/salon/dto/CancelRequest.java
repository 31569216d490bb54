package com.ai.salon.dto;

public record CancelRequest(String reason) {
}
