package com.ai.salon.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Knowledge base and resolver settings.
 */
@Data
@ConfigurationProperties(prefix = "knowledge")
public class KnowledgeProperties {

    /**
     * Minimum cosine similarity for a semantic hit.
     */
    private double similarityThreshold = 0.8;

    /**
     * Neighbours fetched per semantic search.
     */
    private int topK = 3;

    /**
     * Curated FAQ list, a JSON array of {question, answer}.
     */
    private String faqLocation = "classpath:faq.json";

    /**
     * Delay between FAQ re-syncs into the index.
     */
    private Duration refreshInterval = Duration.ofMinutes(30);

    private FaqSyncMode faqSyncMode = FaqSyncMode.UPSERT;

    /**
     * How long an embedding is reused for the same text.
     */
    private Duration embeddingCacheTtl = Duration.ofMinutes(10);

    private long embeddingCacheSize = 1000;

    public enum FaqSyncMode {
        /** FAQ item ids derive from the question text; a re-sync replaces existing items. */
        UPSERT,
        /** Every sync inserts fresh items with random ids; duplicates accumulate. */
        APPEND
    }
}
