package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HelpRequestCreated(@JsonProperty("request_id") String requestId, String status) {
}
