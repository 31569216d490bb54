package com.ai.salon.service;

import com.ai.salon.component.FaqCatalog;
import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.dto.KnowledgeItem;
import com.ai.salon.support.ConceptEmbeddingModel;
import com.ai.salon.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeBaseServiceTest {

    private final VectorStore store = TestFixtures.vectorStore(new ConceptEmbeddingModel());

    private KnowledgeBaseService service(KnowledgeProperties properties) {
        FaqCatalog catalog = TestFixtures.loadedFaqCatalog(properties);
        return new KnowledgeBaseService(catalog, new KnowledgeIndex(store), properties);
    }

    private List<Document> stored() {
        return TestFixtures.allDocuments(store, "anything");
    }

    @Test
    void upsertSyncIsIdempotent() {
        KnowledgeBaseService service = service(new KnowledgeProperties());

        assertThat(service.reloadFaq()).isEqualTo(2);
        assertThat(service.reloadFaq()).isEqualTo(2);

        assertThat(stored()).hasSize(2).allSatisfy(document -> {
            assertThat(document.getMetadata()).containsEntry(KnowledgeIndex.SOURCE, KnowledgeItem.SOURCE_FAQ);
            assertThat(document.getMetadata()).containsEntry(KnowledgeIndex.CATEGORY, KnowledgeItem.CATEGORY_FAQ);
        });
    }

    @Test
    void appendSyncAccumulatesCopies() {
        KnowledgeProperties properties = new KnowledgeProperties();
        properties.setFaqSyncMode(KnowledgeProperties.FaqSyncMode.APPEND);
        KnowledgeBaseService service = service(properties);

        service.reloadFaq();
        service.reloadFaq();

        assertThat(stored()).hasSize(4);
    }

    @Test
    void faqIdIgnoresCaseAndSpacing() {
        assertThat(KnowledgeBaseService.faqId("Parking ")).isEqualTo(KnowledgeBaseService.faqId("  parking"));
        assertThat(KnowledgeBaseService.faqId("Parking")).isNotEqualTo(KnowledgeBaseService.faqId("Hours"));
    }

    @Test
    void learnedItemsAreNeverMerged() {
        KnowledgeBaseService service = service(new KnowledgeProperties());

        KnowledgeItem first = service.addToKnowledgeBase("Do you accept crypto?", "Yes.", "payments");
        KnowledgeItem second = service.addToKnowledgeBase("Do you accept crypto?", "Yes, Bitcoin only.", " ");

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.category()).isEqualTo("payments");
        assertThat(second.source()).isEqualTo(KnowledgeItem.SOURCE_SUPERVISOR);
        assertThat(second.category()).isEqualTo("general");
        assertThat(stored()).hasSize(2);
    }
}
