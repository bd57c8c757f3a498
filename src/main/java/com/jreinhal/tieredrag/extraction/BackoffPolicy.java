package com.jreinhal.tieredrag.extraction;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Retry schedule for transient failures of a remote tier. Rate-limit responses are never
 * retried under this policy.
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param initialDelay delay before the second attempt
 * @param multiplier growth factor applied per further attempt
 * @param jitter fraction in [0,1] by which each delay is randomly widened or shortened
 */
public record BackoffPolicy(int maxAttempts, Duration initialDelay, double multiplier, double jitter) {

    public static final BackoffPolicy NONE = new BackoffPolicy(1, Duration.ZERO, 1.0, 0.0);

    public BackoffPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialDelay = initialDelay == null || initialDelay.isNegative() ? Duration.ZERO : initialDelay;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        jitter = Math.max(0.0, Math.min(1.0, jitter));
    }

    /**
     * Delay to wait before {@code attempt} (2-based; the first attempt never waits).
     *
     * @param random source of values in [0,1)
     */
    public Duration delayBefore(int attempt, DoubleSupplier random) {
        if (attempt <= 1 || initialDelay.isZero()) {
            return Duration.ZERO;
        }
        double base = initialDelay.toMillis() * Math.pow(multiplier, attempt - 2);
        double spread = jitter == 0.0 ? 1.0 : 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofMillis(Math.max(0L, Math.round(base * spread)));
    }

    /**
     * Longest total sleep across all retries, with every delay at its jitter maximum.
     */
    public Duration maxTotalDelay() {
        Duration total = Duration.ZERO;
        for (int attempt = 2; attempt <= maxAttempts; attempt++) {
            total = total.plus(delayBefore(attempt, () -> 1.0));
        }
        return total;
    }
}
