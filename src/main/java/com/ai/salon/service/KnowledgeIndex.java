package com.ai.salon.service;

import com.ai.salon.dto.KnowledgeItem;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Knowledge items kept in the vector store. The question is the document text; answer,
 * category, source and creation time travel as metadata. Items are only ever inserted or
 * replaced by id.
 */
@Service
public class KnowledgeIndex {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIndex.class);

    static final String ANSWER = "answer";
    static final String CATEGORY = "category";
    static final String SOURCE = "source";
    static final String CREATED_AT = "created_at";

    private final VectorStore vectorStore;

    public KnowledgeIndex(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    public KnowledgeItem upsert(KnowledgeItem item) {
        upsert(List.of(item));
        return item;
    }

    /**
     * Writes all items in one batch, replacing any stored under the same ids.
     */
    public void upsert(List<KnowledgeItem> items) {
        if (items.isEmpty()) {
            return;
        }
        vectorStore.add(items.stream().map(KnowledgeIndex::toDocument).toList());
    }

    /**
     * Nearest neighbours of {@code query}, best first, unfiltered by score. A stored
     * document that cannot be read back as an item is skipped.
     */
    public List<ScoredKnowledgeItem> search(String query, int limit) {
        List<Document> documents = vectorStore.similaritySearch(SearchRequest.builder()
                .query(query)
                .topK(limit)
                .similarityThreshold(0.0)
                .build());
        List<ScoredKnowledgeItem> hits = new ArrayList<>();
        for (Document document : documents) {
            Optional<KnowledgeItem> item = toItem(document);
            if (item.isEmpty()) {
                log.warn("Skipping unreadable knowledge document {}", document.getId());
                continue;
            }
            hits.add(new ScoredKnowledgeItem(item.get(), document.getScore() == null ? 0.0 : document.getScore()));
        }
        return hits;
    }

    static Document toDocument(KnowledgeItem item) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(ANSWER, StringUtils.defaultString(item.answer()));
        metadata.put(CATEGORY, StringUtils.defaultIfBlank(item.category(), KnowledgeItem.CATEGORY_GENERAL));
        metadata.put(SOURCE, StringUtils.defaultIfBlank(item.source(), KnowledgeItem.SOURCE_SUPERVISOR));
        metadata.put(CREATED_AT, (item.createdAt() == null ? Instant.now() : item.createdAt()).toString());
        return Document.builder()
                .id(item.id())
                .text(item.question())
                .metadata(metadata)
                .build();
    }

    static Optional<KnowledgeItem> toItem(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        String answer = Objects.toString(metadata.get(ANSWER), null);
        if (StringUtils.isAnyBlank(document.getText(), answer)) {
            return Optional.empty();
        }
        return Optional.of(new KnowledgeItem(
                document.getId(),
                document.getText(),
                answer,
                Objects.toString(metadata.get(CATEGORY), KnowledgeItem.CATEGORY_GENERAL),
                Objects.toString(metadata.get(SOURCE), KnowledgeItem.SOURCE_SUPERVISOR),
                createdAt(metadata.get(CREATED_AT))));
    }

    private static Instant createdAt(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.debug("Unreadable created_at {}", value);
            return null;
        }
    }

    public record ScoredKnowledgeItem(KnowledgeItem item, double score) {
    }
}
