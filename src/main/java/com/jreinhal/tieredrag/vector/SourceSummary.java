package com.jreinhal.tieredrag.vector;

import java.time.Instant;

/**
 * Per-document view over the chunks of one source file.
 */
public record SourceSummary(String source, long chunkCount, String tierUsed, Double qualityScore,
                            Double extractionCost, Instant uploadedAt) {
}
