package com.jreinhal.tieredrag.retrieval;

import java.util.Map;

/**
 * @param queryEmbedding precomputed dense query vector, or null to embed {@code query}
 * @param sparseTerms precomputed sparse query weights, or null to derive them from {@code query}
 */
public record HybridSearchRequest(String knowledgeBase, String query, int topK, boolean useRerank,
                                  boolean deduplicate, float[] queryEmbedding, Map<String, Float> sparseTerms) {

    public static HybridSearchRequest of(String knowledgeBase, String query, int topK, boolean useRerank,
                                         boolean deduplicate) {
        return new HybridSearchRequest(knowledgeBase, query, topK, useRerank, deduplicate, null, null);
    }
}
