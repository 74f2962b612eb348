package com.sahd.search.resilience;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, Clock.systemUTC());
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public boolean allowRequest() {
        return clock.millis() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
    }

    public boolean recordFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        if (failures < failureThreshold) {
            return false;
        }
        openUntilMs.set(clock.millis() + openDurationMs);
        consecutiveFailures.set(0);
        return true;
    }
}
