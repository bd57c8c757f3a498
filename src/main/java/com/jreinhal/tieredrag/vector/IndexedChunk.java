package com.jreinhal.tieredrag.vector;

import java.util.Map;

/**
 * A chunk ready for storage: text, metadata, dense vector and sparse term weights.
 */
public record IndexedChunk(String id, String text, Map<String, Object> metadata, float[] embedding,
                           Map<String, Float> sparseWeights) {

    public IndexedChunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        sparseWeights = sparseWeights == null ? Map.of() : Map.copyOf(sparseWeights);
    }
}
