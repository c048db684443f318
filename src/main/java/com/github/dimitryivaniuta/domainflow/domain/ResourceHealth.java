package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Persisted health block shared by personas and proxies.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
public class ResourceHealth {

    /**
     * False while the circuit is open.
     */
    @Column(name = "healthy", nullable = false)
    private boolean healthy = true;

    @Column(name = "total_requests", nullable = false)
    private long totalRequests;

    @Column(name = "failed_requests", nullable = false)
    private long failedRequests;

    @Column(name = "success_rate", nullable = false)
    private double successRate = 1.0d;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "last_checked_at")
    private Instant lastCheckedAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    public HealthState toState() {
        return new HealthState(totalRequests, failedRequests, consecutiveFailures, lastCheckedAt, lastUsedAt, lastError);
    }

    /**
     * Copies a computed state into the persisted block.
     *
     * @param state   new state
     * @param healthy whether the circuit is closed after the transition
     */
    public void apply(HealthState state, boolean healthy) {
        this.totalRequests = state.totalRequests();
        this.failedRequests = state.failedRequests();
        this.successRate = state.successRate();
        this.consecutiveFailures = state.consecutiveFailures();
        this.lastCheckedAt = state.lastCheckedAt();
        this.lastUsedAt = state.lastUsedAt();
        this.lastError = state.lastError();
        this.healthy = healthy;
    }
}
