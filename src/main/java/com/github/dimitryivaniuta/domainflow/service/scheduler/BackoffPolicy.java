package com.github.dimitryivaniuta.domainflow.service.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff: {@code base * 2^attempts}, capped at {@code max}. No jitter, so retry times
 * are reproducible.
 */
public final class BackoffPolicy {

    private final Duration base;
    private final Duration max;

    public BackoffPolicy(Duration base, Duration max) {
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.base = base;
        this.max = max;
    }

    /**
     * Delay after {@code attempts} failed attempts.
     *
     * @param attempts attempts so far, 0 or more
     * @return delay
     */
    public Duration delay(int attempts) {
        long baseMs = base.toMillis();
        long maxMs = max.toMillis();
        int shift = Math.max(0, Math.min(attempts, 62));
        long factor = 1L << shift;
        long candidate = baseMs > maxMs / factor ? maxMs : baseMs * factor;
        return Duration.ofMillis(Math.min(candidate, maxMs));
    }

    public Instant nextExecution(Instant now, int attempts) {
        return now.plus(delay(attempts));
    }
}
