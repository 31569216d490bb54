package com.ai.salon.dto;

import jakarta.validation.constraints.NotBlank;

public record HelpQuestion(@NotBlank String question) {
}
