package com.jreinhal.tieredrag.extraction;

import java.time.Duration;
import java.util.Optional;

public class RateLimitedException extends ExtractionFailedException {
    private final Duration retryAfter;

    public RateLimitedException(ExtractionTier tier, String message, Duration retryAfter) {
        super(tier, message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String category() {
        return "rate limited";
    }
}
