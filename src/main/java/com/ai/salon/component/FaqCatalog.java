package com.ai.salon.component;

import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.dto.FaqEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The curated FAQ list, in file order. A missing or malformed file leaves the
 * catalog empty rather than failing startup.
 */
@Component
public class FaqCatalog {

    private static final Logger log = LoggerFactory.getLogger(FaqCatalog.class);

    private final ResourceLoader resourceLoader;
    private final KnowledgeProperties properties;
    private final ObjectMapper mapper;

    private volatile List<FaqEntry> entries = List.of();
    private volatile Instant lastUpdated;

    public FaqCatalog(ResourceLoader resourceLoader, KnowledgeProperties properties, ObjectMapper mapper) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
        this.mapper = mapper;
    }

    public List<FaqEntry> reload() {
        entries = read(properties.getFaqLocation());
        lastUpdated = Instant.now();
        log.info("Loaded {} FAQs from {}", entries.size(), properties.getFaqLocation());
        return entries;
    }

    public List<FaqEntry> entries() {
        return entries;
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    /**
     * Keyword match: an entry matches when any word of its question occurs inside the
     * lower-cased query. First match in file order wins.
     */
    public Optional<FaqEntry> match(String query) {
        if (StringUtils.isBlank(query)) {
            return Optional.empty();
        }
        String normalized = query.toLowerCase(Locale.ENGLISH);
        for (FaqEntry faq : entries) {
            for (String word : StringUtils.split(faq.question().toLowerCase(Locale.ENGLISH))) {
                if (normalized.contains(word)) {
                    return Optional.of(faq);
                }
            }
        }
        return Optional.empty();
    }

    private List<FaqEntry> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("FAQ file not found: {}", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = mapper.readTree(in);
            if (root == null || !root.isArray()) {
                log.warn("FAQ JSON is not a list: {}", location);
                return List.of();
            }
            List<FaqEntry> loaded = mapper.convertValue(root, new TypeReference<List<FaqEntry>>() { });
            return loaded.stream()
                    .filter(f -> StringUtils.isNoneBlank(f.question(), f.answer()))
                    .toList();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to parse FAQ file {}", location, e);
            return List.of();
        }
    }
}
