package com.jreinhal.tieredrag.extraction;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    void firstAttemptNeverWaits() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ofMillis(200), 2.0, 0.0);
        assertEquals(Duration.ZERO, policy.delayBefore(1, () -> 0.5));
    }

    @Test
    void delayGrowsByMultiplier() {
        BackoffPolicy policy = new BackoffPolicy(4, Duration.ofMillis(200), 2.0, 0.0);
        assertEquals(Duration.ofMillis(200), policy.delayBefore(2, () -> 0.5));
        assertEquals(Duration.ofMillis(400), policy.delayBefore(3, () -> 0.5));
        assertEquals(Duration.ofMillis(800), policy.delayBefore(4, () -> 0.5));
    }

    @Test
    void jitterWidensOrShortensDelay() {
        BackoffPolicy policy = new BackoffPolicy(2, Duration.ofMillis(1000), 2.0, 0.5);
        assertEquals(Duration.ofMillis(500), policy.delayBefore(2, () -> 0.0));
        assertEquals(Duration.ofMillis(1000), policy.delayBefore(2, () -> 0.5));
        assertEquals(Duration.ofMillis(1480), policy.delayBefore(2, () -> 0.98));
    }

    @Test
    void maxTotalDelayAddsJitteredUpperBounds() {
        assertEquals(Duration.ofMillis(900), new BackoffPolicy(3, Duration.ofMillis(200), 2.0, 0.5).maxTotalDelay());
        assertEquals(Duration.ofMillis(600), new BackoffPolicy(3, Duration.ofMillis(200), 2.0, 0.0).maxTotalDelay());
        assertEquals(Duration.ZERO, BackoffPolicy.NONE.maxTotalDelay());
    }

    @Test
    void normalisesOutOfRangeValues() {
        BackoffPolicy policy = new BackoffPolicy(0, Duration.ofMillis(-5), 0.5, 3.0);
        assertEquals(1, policy.maxAttempts());
        assertEquals(Duration.ZERO, policy.initialDelay());
        assertEquals(1.0, policy.multiplier());
        assertEquals(1.0, policy.jitter());
        assertEquals(Duration.ZERO, policy.delayBefore(2, () -> 0.5));
    }
}
