package com.jreinhal.tieredrag.embedding;

import java.util.List;

/**
 * Dense text embeddings for queries, chunks and knowledge-base descriptions.
 */
public interface EmbeddingProvider {

    /**
     * @throws EmbeddingUnavailableException if the embedding backend fails
     */
    float[] embed(String text);

    /**
     * One vector per input text, same order.
     *
     * @throws EmbeddingUnavailableException if the embedding backend fails
     */
    List<float[]> embedAll(List<String> texts);
}
