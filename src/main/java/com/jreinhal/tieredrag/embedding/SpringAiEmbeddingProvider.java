package com.jreinhal.tieredrag.embedding;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link EmbeddingProvider} backed by the Spring AI {@link EmbeddingModel} (Ollama by default).
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;

    @Value("${tieredrag.embedding.batch-size:32}")
    private int batchSize = 32;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            log.warn("Embedding request failed: {}", e.getMessage());
            throw new EmbeddingUnavailableException("Embedding model unavailable: " + e.getMessage(), e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return vector;
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        int step = Math.max(1, batchSize);
        for (int i = 0; i < texts.size(); i += step) {
            List<String> batch = texts.subList(i, Math.min(i + step, texts.size()));
            List<float[]> embedded;
            try {
                embedded = embeddingModel.embed(batch);
            } catch (RuntimeException e) {
                log.warn("Batch embedding failed at offset {}: {}", i, e.getMessage());
                throw new EmbeddingUnavailableException("Embedding model unavailable: " + e.getMessage(), e);
            }
            if (embedded == null || embedded.size() != batch.size()) {
                throw new EmbeddingUnavailableException("Embedding model returned "
                        + (embedded == null ? 0 : embedded.size()) + " vectors for " + batch.size() + " texts");
            }
            vectors.addAll(embedded);
        }
        return vectors;
    }
}
