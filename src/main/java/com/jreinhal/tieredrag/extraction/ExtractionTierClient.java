package com.jreinhal.tieredrag.extraction;

/**
 * Performs one extraction attempt for the tiers it supports.
 *
 * <p>Implementations fail with {@link TierUnavailableException}, {@link RateLimitedException}
 * or {@link ExtractionEmptyException}. They honour thread interruption so a cancelled
 * attempt stops promptly.</p>
 */
public interface ExtractionTierClient {

    boolean supports(ExtractionTier tier);

    TierOutput extract(byte[] content, String filename, TierSettings settings);
}
