package com.ai.salon.config;

import com.ai.salon.service.CachingEmbeddingModel;
import com.ai.salon.service.OpenAiRestEmbeddingModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.BatchingStrategy;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.observation.VectorStoreObservationConvention;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.ai.vectorstore.pgvector.autoconfigure.PgVectorStoreProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.client.RestTemplate;

/**
 * Embedding model and the pgvector-backed store the knowledge index lives in.
 */
@Configuration
public class KnowledgeStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStoreConfig.class);

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.embedding-model:text-embedding-3-small}")
    private String embeddingModelName;

    @Value("${openai.embedding-dimensions:1536}")
    private int embeddingDimensions;

    @Bean
    public EmbeddingModel embeddingModel(RestTemplate restTemplate, ObjectMapper mapper, KnowledgeProperties properties) {
        log.info("Using OpenAI embedding model {} ({} dimensions)", embeddingModelName, embeddingDimensions);
        return new CachingEmbeddingModel(
                new OpenAiRestEmbeddingModel(restTemplate, mapper, openAiApiKey, embeddingModelName, embeddingDimensions),
                properties.getEmbeddingCacheTtl(),
                properties.getEmbeddingCacheSize());
    }

    @Bean
    public PgVectorStore vectorStore(JdbcTemplate jdbcTemplate,
                                     EmbeddingModel embeddingModel,
                                     PgVectorStoreProperties properties,
                                     ObjectProvider<ObservationRegistry> observationRegistry,
                                     ObjectProvider<VectorStoreObservationConvention> customObservationConvention,
                                     BatchingStrategy batchingStrategy) {
        return PgVectorStore.builder(jdbcTemplate, embeddingModel)
                .schemaName(properties.getSchemaName())
                .idType(properties.getIdType())
                .vectorTableName(properties.getTableName())
                .vectorTableValidationsEnabled(properties.isSchemaValidation())
                .dimensions(properties.getDimensions())
                .distanceType(properties.getDistanceType())
                .removeExistingVectorStoreTable(properties.isRemoveExistingVectorStoreTable())
                .indexType(properties.getIndexType())
                .initializeSchema(properties.isInitializeSchema())
                .observationRegistry(observationRegistry.getIfUnique(() -> ObservationRegistry.NOOP))
                .customObservationConvention(customObservationConvention.getIfAvailable(() -> null))
                .batchingStrategy(batchingStrategy)
                .maxDocumentBatchSize(properties.getMaxDocumentBatchSize())
                .build();
    }
}
