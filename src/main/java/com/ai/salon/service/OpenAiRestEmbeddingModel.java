package com.ai.salon.service;

import com.ai.salon.exception.DependencyUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeddings from the OpenAI embeddings endpoint. Every vector must come back with the
 * configured dimensionality; anything else is treated as the service being unavailable.
 */
public class OpenAiRestEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRestEmbeddingModel.class);

    static final String EMBEDDINGS_URL = "https://api.openai.com/v1/embeddings";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String apiKey;
    private final String model;
    private final int dimensions;

    public OpenAiRestEmbeddingModel(RestTemplate restTemplate, ObjectMapper mapper,
                                    String apiKey, String model, int dimensions) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.apiKey = apiKey;
        this.model = model;
        this.dimensions = dimensions;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<String> texts = request.getInstructions();
        if (texts.isEmpty()) {
            return new EmbeddingResponse(List.of());
        }
        if (StringUtils.isBlank(apiKey)) {
            throw new DependencyUnavailableException("OPENAI_API_KEY is not set");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", texts);
        body.put("dimensions", dimensions);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(EMBEDDINGS_URL, new HttpEntity<>(body, headers), String.class);
            JsonNode data = mapper.readTree(response.getBody()).path("data");
            if (!data.isArray() || data.size() != texts.size()) {
                throw new DependencyUnavailableException("Expected " + texts.size() + " embeddings, got " + data.size());
            }
            List<Embedding> embeddings = new ArrayList<>();
            for (JsonNode item : data) {
                JsonNode vector = item.path("embedding");
                if (!vector.isArray() || vector.size() != dimensions) {
                    throw new DependencyUnavailableException("Embedding must have " + dimensions
                            + " dimensions, got " + vector.size());
                }
                float[] values = new float[vector.size()];
                for (int i = 0; i < values.length; i++) {
                    values[i] = (float) vector.get(i).asDouble();
                }
                embeddings.add(new Embedding(values, item.path("index").asInt(embeddings.size())));
            }
            embeddings.sort(Comparator.comparingInt(Embedding::getIndex));
            return new EmbeddingResponse(embeddings);
        } catch (RestClientException | IOException e) {
            log.error("Embedding request failed", e);
            throw new DependencyUnavailableException("Embedding service unavailable", e);
        }
    }

    @Override
    public float[] embed(Document document) {
        return embed(document.getText());
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
