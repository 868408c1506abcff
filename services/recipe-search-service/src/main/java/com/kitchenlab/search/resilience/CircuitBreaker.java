package com.kitchenlab.search.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Consecutive-failure breaker: opens after {@code failureThreshold} failures in a row and rejects
 * calls until {@code openDurationMs} has elapsed.
 */
public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public boolean allowRequest() {
        return clock.getAsLong() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public void recordFailure() {
        if (consecutiveFailures.incrementAndGet() >= failureThreshold) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            consecutiveFailures.set(0);
        }
    }
}
