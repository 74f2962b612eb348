package com.sahd.search.service;

import java.util.function.LongSupplier;

class RequestDeadline {
    private final LongSupplier nanoClock;
    private final long expiresAtNanos;
    private final boolean bounded;

    private RequestDeadline(LongSupplier nanoClock, long expiresAtNanos, boolean bounded) {
        this.nanoClock = nanoClock;
        this.expiresAtNanos = expiresAtNanos;
        this.bounded = bounded;
    }

    static RequestDeadline of(Integer timeoutMs) {
        return of(timeoutMs, System::nanoTime);
    }

    static RequestDeadline of(Integer timeoutMs, LongSupplier nanoClock) {
        if (timeoutMs == null) {
            return new RequestDeadline(nanoClock, Long.MAX_VALUE, false);
        }
        return new RequestDeadline(nanoClock, nanoClock.getAsLong() + timeoutMs * 1_000_000L, true);
    }

    boolean isExpired() {
        return bounded && nanoClock.getAsLong() >= expiresAtNanos;
    }

    Integer budgetMs() {
        if (!bounded) {
            return null;
        }
        long remaining = (expiresAtNanos - nanoClock.getAsLong()) / 1_000_000L;
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, remaining));
    }
}
