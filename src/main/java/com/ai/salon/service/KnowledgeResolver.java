package com.ai.salon.service;

import com.ai.salon.component.FaqCatalog;
import com.ai.salon.config.KnowledgeProperties;
import com.ai.salon.dto.FaqEntry;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Answers a question from the FAQ keywords first, then by semantic search over the
 * knowledge index. Read-only: never writes to the index.
 */
@Service
public class KnowledgeResolver {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeResolver.class);

    private final FaqCatalog faqCatalog;
    private final KnowledgeIndex index;
    private final EmbeddingModel embeddingModel;
    private final KnowledgeProperties properties;
    private final Executor embeddingExecutor;
    private final Executor ioExecutor;

    public KnowledgeResolver(FaqCatalog faqCatalog,
                             KnowledgeIndex index,
                             EmbeddingModel embeddingModel,
                             KnowledgeProperties properties,
                             @Qualifier("embeddingExecutor") Executor embeddingExecutor,
                             @Qualifier("ioExecutor") Executor ioExecutor) {
        this.faqCatalog = faqCatalog;
        this.index = index;
        this.embeddingModel = embeddingModel;
        this.properties = properties;
        this.embeddingExecutor = embeddingExecutor;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Completes with {@link Tier#UNRESOLVED} when neither tier has an answer, including
     * when a tier fails. It never completes exceptionally.
     */
    public CompletableFuture<KnowledgeAnswer> resolve(String question) {
        if (StringUtils.isBlank(question)) {
            return CompletableFuture.completedFuture(KnowledgeAnswer.unresolved());
        }
        String query = question.trim().toLowerCase(Locale.ENGLISH);

        Optional<KnowledgeAnswer> faq = lexical(query);
        if (faq.isPresent()) {
            log.info("Found FAQ answer for: {}", question);
            return CompletableFuture.completedFuture(faq.get());
        }
        return semantic(query).thenApply(answer -> {
            if (answer.isResolved()) {
                log.info("Found KB answer for: {} (score={})", question, String.format("%.3f", answer.score()));
            }
            return answer;
        });
    }

    private Optional<KnowledgeAnswer> lexical(String query) {
        try {
            return faqCatalog.match(query).map(KnowledgeAnswer::faq);
        } catch (RuntimeException e) {
            log.warn("FAQ search failed", e);
            return Optional.empty();
        }
    }

    private CompletableFuture<KnowledgeAnswer> semantic(String query) {
        double threshold = properties.getSimilarityThreshold();
        // the embedding model caches by text, so the store's own embedding of the query is a hit
        return CompletableFuture.supplyAsync(() -> embeddingModel.embed(query), embeddingExecutor)
                .thenApplyAsync(vector -> index.search(query, properties.getTopK()), ioExecutor)
                .thenApply(hits -> best(hits, threshold))
                .exceptionally(ex -> {
                    log.warn("KB search failed: {}", ex.getMessage());
                    return KnowledgeAnswer.unresolved();
                });
    }

    private static KnowledgeAnswer best(List<KnowledgeIndex.ScoredKnowledgeItem> hits, double threshold) {
        if (hits.isEmpty()) {
            return KnowledgeAnswer.unresolved();
        }
        KnowledgeIndex.ScoredKnowledgeItem top = hits.get(0);
        if (top.score() < threshold) {
            log.debug("Best KB score {} below threshold {}", top.score(), threshold);
            return KnowledgeAnswer.unresolved();
        }
        return new KnowledgeAnswer(Tier.KNOWLEDGE_BASE, top.item().answer(), top.item().question(), top.score());
    }

    public enum Tier { FAQ, KNOWLEDGE_BASE, UNRESOLVED }

    public record KnowledgeAnswer(Tier tier, String answer, String matchedQuestion, double score) {

        static KnowledgeAnswer faq(FaqEntry entry) {
            return new KnowledgeAnswer(Tier.FAQ, entry.answer(), entry.question(), 1.0);
        }

        static KnowledgeAnswer unresolved() {
            return new KnowledgeAnswer(Tier.UNRESOLVED, null, null, 0.0);
        }

        public boolean isResolved() {
            return tier != Tier.UNRESOLVED;
        }
    }
}
