package com.jreinhal.tieredrag.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every enabled tier failed outright; no text is available for the document.
 */
public class AllTiersExhaustedException extends RuntimeException {
    private final Map<ExtractionTier, String> failures;

    public AllTiersExhaustedException(Map<ExtractionTier, String> failures) {
        super("all tiers failed: " + failures);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<ExtractionTier, String> getFailures() {
        return failures;
    }
}
