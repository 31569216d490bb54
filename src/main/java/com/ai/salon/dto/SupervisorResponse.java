package com.ai.salon.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * A supervisor's answer to a pending help request.
 */
public record SupervisorResponse(
        @NotBlank String answer,
        @JsonProperty("resolution_notes") String resolutionNotes,
        @JsonProperty("add_to_knowledge_base") Boolean addToKnowledgeBase,
        @JsonProperty("kb_category") String kbCategory
) {

    public static final String DEFAULT_CATEGORY = "general";

    public SupervisorResponse {
        if (addToKnowledgeBase == null) {
            addToKnowledgeBase = Boolean.TRUE;
        }
        if (kbCategory == null || kbCategory.isBlank()) {
            kbCategory = DEFAULT_CATEGORY;
        }
    }

    public boolean shouldAddToKnowledgeBase() {
        return addToKnowledgeBase;
    }
}
