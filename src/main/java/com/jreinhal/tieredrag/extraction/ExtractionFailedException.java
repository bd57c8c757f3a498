package com.jreinhal.tieredrag.extraction;

/**
 * A single tier failed to produce usable text. Recovered by moving to the next tier.
 */
public abstract class ExtractionFailedException extends RuntimeException {
    private final ExtractionTier tier;

    protected ExtractionFailedException(ExtractionTier tier, String message) {
        super(message);
        this.tier = tier;
    }

    protected ExtractionFailedException(ExtractionTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public ExtractionTier getTier() {
        return tier;
    }

    /**
     * Short failure category used in escalation reasons, e.g. {@code "unavailable"}.
     */
    public abstract String category();
}
