package com.jreinhal.tieredrag.extraction;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a progressive extraction.
 *
 * @param selected the highest-scoring attempt
 * @param attempts every attempt that produced text, in the order tried
 * @param tiersTried every tier invoked, including those that failed
 * @param failures failure reason per failed tier
 * @param escalationReason why the controller stopped where it did
 * @param cancelled whether the caller cancelled before the tier sequence finished
 */
public record ExtractionResult(ExtractionAttempt selected, List<ExtractionAttempt> attempts,
                               List<ExtractionTier> tiersTried, Map<ExtractionTier, String> failures,
                               String escalationReason, boolean cancelled) {

    public ExtractionResult {
        if (selected == null || attempts == null || attempts.isEmpty()) {
            throw new IllegalArgumentException("An extraction result needs at least one attempt");
        }
        attempts = List.copyOf(attempts);
        tiersTried = List.copyOf(tiersTried);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<ExtractionTier> attemptedTiers() {
        return attempts.stream().map(ExtractionAttempt::tier).toList();
    }

    public double totalCost() {
        return attempts.stream().mapToDouble(ExtractionAttempt::cost).sum();
    }

    public Duration totalDuration() {
        return attempts.stream().map(ExtractionAttempt::duration).reduce(Duration.ZERO, Duration::plus);
    }
}
