package com.jreinhal.tieredrag.retrieval.sparse;

import java.util.List;
import java.util.Map;

/**
 * One sidecar request's worth of texts. {@code weights} holds one map per text when the
 * sidecar answered; otherwise it is empty and {@code fallbackReason} says why.
 */
public record SparseBatch(int offset, List<String> texts, List<Map<String, Float>> weights,
                          FallbackReason fallbackReason) {

    public enum FallbackReason {
        DISABLED,
        UNREACHABLE,
        HTTP_STATUS,
        REDIRECT,
        MALFORMED_RESPONSE,
        COUNT_MISMATCH
    }

    static SparseBatch learned(int offset, List<String> texts, List<Map<String, Float>> weights) {
        return new SparseBatch(offset, texts, List.copyOf(weights), null);
    }

    static SparseBatch fallback(int offset, List<String> texts, FallbackReason reason) {
        return new SparseBatch(offset, texts, List.of(), reason);
    }

    public boolean isLearned() {
        return this.fallbackReason == null;
    }
}
