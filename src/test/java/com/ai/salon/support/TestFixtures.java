package com.ai.salon.support;

import com.ai.salon.component.BookingRules;
import com.ai.salon.component.FaqCatalog;
import com.ai.salon.component.ResponsePhrases;
import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.config.SalonProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static BookingRules bookingRules() {
        return new BookingRules(new SalonProperties(), new ResponsePhrases());
    }

    /**
     * Catalog over {@code faq-test.json}: "Hours" and "Parking".
     */
    public static FaqCatalog loadedFaqCatalog(KnowledgeProperties properties) {
        properties.setFaqLocation("classpath:faq-test.json");
        FaqCatalog catalog = new FaqCatalog(new DefaultResourceLoader(), properties, new ObjectMapper());
        catalog.reload();
        return catalog;
    }

    public static VectorStore vectorStore(EmbeddingModel embeddingModel) {
        return SimpleVectorStore.builder(embeddingModel).build();
    }

    /**
     * Everything in a small test store, whatever its score against {@code query}.
     */
    public static List<Document> allDocuments(VectorStore store, String query) {
        return store.similaritySearch(SearchRequest.builder()
                .query(query)
                .topK(1000)
                .similarityThreshold(0.0)
                .build());
    }
}
