package com.jreinhal.tieredrag.extraction;

public class TierUnavailableException extends ExtractionFailedException {

    public TierUnavailableException(ExtractionTier tier, String message) {
        super(tier, message);
    }

    public TierUnavailableException(ExtractionTier tier, String message, Throwable cause) {
        super(tier, message, cause);
    }

    @Override
    public String category() {
        return "unavailable";
    }
}
