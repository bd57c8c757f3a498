package com.jreinhal.tieredrag.reasoning;

import java.util.Map;

public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public enum StepType {
        TIER_ATTEMPT,
        QUALITY_SCORING,
        ESCALATION,
        QUERY_EMBEDDING,
        DENSE_RETRIEVAL,
        SPARSE_RETRIEVAL,
        RRF_FUSION,
        RERANK,
        DEDUPLICATION,
        CHUNKING,
        METADATA_EXTRACTION,
        INDEXING,
        ROUTING,
        GENERATION,
        ERROR
    }
}
