package com.jreinhal.tieredrag.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

public class SimpleCircuitBreaker {
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        this(name, failureThreshold, openDuration, halfOpenMaxCalls, System::currentTimeMillis);
    }

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls,
                                LongSupplier clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.getAsLong();
        if (this.state == State.OPEN) {
            if (now < this.openUntilEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.openUntilEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.halfOpenCalls.set(0);
                }
            }
        }
        return this.halfOpenCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.failureCount.set(0);
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
            this.openUntilEpochMs = 0L;
        }
    }

    public void recordFailure() {
        if (this.state == State.HALF_OPEN) {
            openCircuit();
            return;
        }
        if (this.failureCount.incrementAndGet() >= this.failureThreshold) {
            openCircuit();
        }
    }

    public State getState() {
        return this.state;
    }

    public String getName() {
        return this.name;
    }

    private void openCircuit() {
        synchronized (this) {
            this.state = State.OPEN;
            this.openUntilEpochMs = this.clock.getAsLong() + this.openDuration.toMillis();
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
        }
    }
}
