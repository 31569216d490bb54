package com.ai.salon.dto;

public record FaqEntry(String question, String answer) {
}
