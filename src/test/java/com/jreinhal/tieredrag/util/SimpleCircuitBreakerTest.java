package com.jreinhal.tieredrag.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class SimpleCircuitBreakerTest {

    private final AtomicLong clock = new AtomicLong(1_000L);

    @Test
    void opensAfterThresholdFailures() {
        SimpleCircuitBreaker breaker = breaker(2);

        breaker.recordFailure();
        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        breaker.recordFailure();

        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void successResetsFailureCount() {
        SimpleCircuitBreaker breaker = breaker(2);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void halfOpensAfterOpenDurationAndAllowsOneTrialCall() {
        SimpleCircuitBreaker breaker = breaker(1);
        breaker.recordFailure();

        clock.addAndGet(30_000L);

        assertTrue(breaker.allowRequest());
        assertEquals(SimpleCircuitBreaker.State.HALF_OPEN, breaker.getState());
        assertFalse(breaker.allowRequest());
    }

    @Test
    void trialSuccessClosesAndTrialFailureReopens() {
        SimpleCircuitBreaker breaker = breaker(1);
        breaker.recordFailure();
        clock.addAndGet(30_000L);
        breaker.allowRequest();
        breaker.recordFailure();
        assertEquals(SimpleCircuitBreaker.State.OPEN, breaker.getState());

        clock.addAndGet(30_000L);
        breaker.allowRequest();
        breaker.recordSuccess();

        assertEquals(SimpleCircuitBreaker.State.CLOSED, breaker.getState());
        assertTrue(breaker.allowRequest());
    }

    private SimpleCircuitBreaker breaker(int threshold) {
        return new SimpleCircuitBreaker("test", threshold, Duration.ofSeconds(30), 1, clock::get);
    }
}
