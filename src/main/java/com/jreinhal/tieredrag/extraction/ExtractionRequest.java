package com.jreinhal.tieredrag.extraction;

import java.util.Set;

/**
 * @param tiersEnabled tiers the caller allows; {@code null} means every configured, enabled tier
 */
public record ExtractionRequest(String filename, byte[] content, double targetQuality,
                                Set<ExtractionTier> tiersEnabled) {

    public ExtractionRequest {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Document content is empty");
        }
        if (Double.isNaN(targetQuality) || targetQuality < 0.0 || targetQuality > 1.0) {
            throw new IllegalArgumentException("Target quality must lie in [0,1]");
        }
        filename = filename == null || filename.isBlank() ? "document" : filename;
        tiersEnabled = tiersEnabled == null ? null : Set.copyOf(tiersEnabled);
    }
}
