package com.ai.salon.service;

import com.ai.salon.component.FaqCatalog;
import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.dto.KnowledgeItem;
import com.ai.salon.support.ConceptEmbeddingModel;
import com.ai.salon.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class KnowledgeResolverTest {

    private KnowledgeProperties properties;
    private ConceptEmbeddingModel embedder;
    private EmbeddingModel embeddingModel;
    private KnowledgeIndex index;
    private KnowledgeResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new KnowledgeProperties();
        FaqCatalog catalog = TestFixtures.loadedFaqCatalog(properties);
        embedder = new ConceptEmbeddingModel();
        embeddingModel = new CachingEmbeddingModel(embedder, Duration.ofMinutes(10), 100);
        index = new KnowledgeIndex(TestFixtures.vectorStore(embeddingModel));
        resolver = new KnowledgeResolver(catalog, index, embeddingModel, properties, Runnable::run, Runnable::run);
    }

    private void learn(String question, String answer) {
        index.upsert(new KnowledgeItem(question, question, answer, "general", KnowledgeItem.SOURCE_SUPERVISOR, Instant.now()));
    }

    @Test
    void faqKeywordHitNeverEmbeds() {
        learn("Do you accept crypto?", "Yes, we accept Bitcoin.");
        int callsBefore = embedder.calls();

        KnowledgeResolver.KnowledgeAnswer answer = resolver.resolve("Where can I find parking?").join();

        assertThat(answer.tier()).isEqualTo(KnowledgeResolver.Tier.FAQ);
        assertThat(answer.answer()).contains("Free parking");
        assertThat(embedder.calls()).isEqualTo(callsBefore);
    }

    @Test
    void semanticHitAboveThreshold() {
        learn("Do you accept crypto?", "Yes, we accept Bitcoin.");

        KnowledgeResolver.KnowledgeAnswer answer = resolver.resolve("Can I pay with bitcoin?").join();

        assertThat(answer.tier()).isEqualTo(KnowledgeResolver.Tier.KNOWLEDGE_BASE);
        assertThat(answer.answer()).isEqualTo("Yes, we accept Bitcoin.");
        assertThat(answer.matchedQuestion()).isEqualTo("Do you accept crypto?");
        assertThat(answer.score()).isGreaterThanOrEqualTo(0.8);
    }

    @Test
    void questionIsEmbeddedOnce() {
        learn("Do you accept crypto?", "Yes, we accept Bitcoin.");
        int callsBefore = embedder.calls();

        resolver.resolve("Can I pay with bitcoin?").join();

        assertThat(embedder.calls()).isEqualTo(callsBefore + 1);
    }

    @Test
    void weakMatchStaysUnresolved() {
        learn("Do you accept crypto?", "Yes, we accept Bitcoin.");

        // shares one of two concepts: cosine 0.707
        KnowledgeResolver.KnowledgeAnswer answer = resolver.resolve("Is bitcoin popular?").join();

        assertThat(answer.isResolved()).isFalse();
        assertThat(answer.answer()).isNull();
    }

    @Test
    void thresholdIsConfigurable() {
        learn("Do you accept crypto?", "Yes, we accept Bitcoin.");
        properties.setSimilarityThreshold(0.7);

        assertThat(resolver.resolve("Is bitcoin popular?").join().isResolved()).isTrue();
    }

    @Test
    void emptyIndexAndBlankQuestionAreUnresolved() {
        assertThat(resolver.resolve("Do you sell gift cards?").join().tier()).isEqualTo(KnowledgeResolver.Tier.UNRESOLVED);
        assertThat(resolver.resolve("   ").join().tier()).isEqualTo(KnowledgeResolver.Tier.UNRESOLVED);
    }

    @Test
    void failingEmbeddingModelIsTreatedAsUnresolved() {
        EmbeddingModel broken = new EmbeddingModel() {
            @Override
            public EmbeddingResponse call(EmbeddingRequest request) {
                throw new IllegalStateException("embedding backend down");
            }

            @Override
            public float[] embed(Document document) {
                throw new IllegalStateException("embedding backend down");
            }
        };
        KnowledgeResolver failing = new KnowledgeResolver(TestFixtures.loadedFaqCatalog(properties), index, broken,
                properties, Runnable::run, Runnable::run);

        assertThat(failing.resolve("Do you sell gift cards?").join().isResolved()).isFalse();
        assertThat(failing.resolve("what are your hours?").join().tier()).isEqualTo(KnowledgeResolver.Tier.FAQ);
    }

    @Test
    void searchUsesTopK() {
        VectorStore store = mock(VectorStore.class);
        when(store.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());
        KnowledgeResolver topK = new KnowledgeResolver(TestFixtures.loadedFaqCatalog(properties), new KnowledgeIndex(store),
                embeddingModel, properties, Runnable::run, Runnable::run);

        assertThat(topK.resolve("Do you accept crypto?").join().isResolved()).isFalse();

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(store).similaritySearch(request.capture());
        assertThat(request.getValue().getTopK()).isEqualTo(3);
        assertThat(request.getValue().getQuery()).isEqualTo("do you accept crypto?");
    }
}
