package com.jreinhal.tieredrag.extraction;

import java.time.Duration;

/**
 * Per-tier configuration handed to an {@link ExtractionTierClient} with each call.
 */
public record TierSettings(
        ExtractionTier tier,
        boolean enabled,
        double costPerPage,
        double qualityCeiling,
        String serviceUrl,
        String model,
        Duration timeout,
        BackoffPolicy backoff) {

    public TierSettings {
        if (tier == null) {
            throw new IllegalArgumentException("tier is required");
        }
        timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        backoff = backoff == null ? BackoffPolicy.NONE : backoff;
    }

    public static TierSettings defaults(ExtractionTier tier) {
        return new TierSettings(tier, true, tier.defaultCostPerPage(), tier.defaultQualityCeiling(),
                null, null, Duration.ofSeconds(60), BackoffPolicy.NONE);
    }
}
