package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HelpRequestResolution(
        @JsonProperty("help_request") HelpRequestView helpRequest,
        @JsonProperty("knowledge_base_updated") boolean knowledgeBaseUpdated
) {
}
