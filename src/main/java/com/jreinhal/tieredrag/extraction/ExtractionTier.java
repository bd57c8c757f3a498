package com.jreinhal.tieredrag.extraction;

import java.util.Locale;

/**
 * Text extraction strategies, declared cheapest first. Costs and ceilings are defaults;
 * deployments override them through {@code tieredrag.extraction.tiers.*}.
 */
public enum ExtractionTier {
    FAST(0.0, 0.80),
    BALANCED(0.00008, 0.88),
    PREMIUM(0.0013, 0.97);

    private final double defaultCostPerPage;
    private final double defaultQualityCeiling;

    ExtractionTier(double defaultCostPerPage, double defaultQualityCeiling) {
        this.defaultCostPerPage = defaultCostPerPage;
        this.defaultQualityCeiling = defaultQualityCeiling;
    }

    public double defaultCostPerPage() {
        return defaultCostPerPage;
    }

    public double defaultQualityCeiling() {
        return defaultQualityCeiling;
    }

    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExtractionTier fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Extraction tier must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown extraction tier: " + value.trim());
        }
    }
}
