package com.ai.salon.service;

import com.ai.salon.support.ConceptEmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingResponse;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CachingEmbeddingModelTest {

    private final ConceptEmbeddingModel delegate = new ConceptEmbeddingModel();
    private final CachingEmbeddingModel model = new CachingEmbeddingModel(delegate, Duration.ofMinutes(10), 100);

    @Test
    void repeatedTextIsEmbeddedOnce() {
        float[] first = model.embed("Do you accept crypto?");
        float[] second = model.embed("Do you accept crypto?");

        assertThat(second).isEqualTo(first);
        assertThat(delegate.calls()).isEqualTo(1);
    }

    @Test
    void batchOnlySendsMissingTexts() {
        model.embed("parking");

        EmbeddingResponse response = model.embedForResponse(List.of("parking", "hours", "hours"));

        assertThat(response.getResults()).hasSize(3);
        assertThat(response.getResults().get(1).getOutput()).isEqualTo(response.getResults().get(2).getOutput());
        assertThat(response.getResults().get(2).getIndex()).isEqualTo(2);
        assertThat(delegate.calls()).isEqualTo(2);
    }

    @Test
    void dimensionsComeFromDelegate() {
        assertThat(model.dimensions()).isEqualTo(5);
    }
}
