package com.ai.salon.dto;

import java.time.Instant;

/**
 * One entry of the knowledge index. The question is what gets embedded.
 */
public record KnowledgeItem(String id, String question, String answer, String category, String source, Instant createdAt) {

    public static final String SOURCE_FAQ = "local_file";
    public static final String SOURCE_SUPERVISOR = "supervisor";
    public static final String CATEGORY_FAQ = "faq";
    public static final String CATEGORY_GENERAL = "general";
}
