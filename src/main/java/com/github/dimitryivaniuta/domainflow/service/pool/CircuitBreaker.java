package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit state derived from a resource's health figures.
 *
 * <p>The circuit opens once {@code consecutiveFailures} reaches the threshold. Only a successful
 * probe closes it again, by resetting the failure streak; ordinary traffic never reaches an open
 * resource.</p>
 */
public final class CircuitBreaker {

    private final int failureThreshold;
    private final Duration probeInterval;

    public CircuitBreaker(int failureThreshold, Duration probeInterval) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.failureThreshold = failureThreshold;
        this.probeInterval = probeInterval;
    }

    public boolean isOpen(HealthState health) {
        return health.consecutiveFailures() >= failureThreshold;
    }

    public CircuitState state(HealthState health, Instant now) {
        if (!isOpen(health)) {
            return CircuitState.CLOSED;
        }
        return isProbeDue(health, now) ? CircuitState.HALF_OPEN : CircuitState.OPEN;
    }

    /**
     * Whether an open resource has rested long enough to be probed.
     *
     * @param health health figures
     * @param now    current time
     * @return true when a probe should be sent
     */
    public boolean isProbeDue(HealthState health, Instant now) {
        if (!isOpen(health)) {
            return false;
        }
        Instant since = health.lastCheckedAt();
        if (since == null || (health.lastUsedAt() != null && health.lastUsedAt().isAfter(since))) {
            since = health.lastUsedAt();
        }
        return since == null || !since.plus(probeInterval).isAfter(now);
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }
}
