package com.github.dimitryivaniuta.domainflow.domain;

import java.time.Instant;

/**
 * Immutable health figures of a pooled resource. Transitions return a new value and never touch
 * persistence.
 *
 * @param totalRequests       requests made through the resource
 * @param failedRequests      requests that failed at the transport level
 * @param consecutiveFailures failures since the last success or successful probe
 * @param lastCheckedAt       last health probe
 * @param lastUsedAt          last request
 * @param lastError           last transport error
 */
public record HealthState(
        long totalRequests,
        long failedRequests,
        int consecutiveFailures,
        Instant lastCheckedAt,
        Instant lastUsedAt,
        String lastError
) {

    public static HealthState fresh() {
        return new HealthState(0L, 0L, 0, null, null, null);
    }

    /**
     * Ratio of successful requests; 1.0 for an unused resource.
     *
     * @return success rate in [0, 1]
     */
    public double successRate() {
        if (totalRequests == 0) {
            return 1.0d;
        }
        return (double) (totalRequests - failedRequests) / (double) totalRequests;
    }

    public HealthState afterSuccess(Instant now) {
        return new HealthState(totalRequests + 1, failedRequests, 0, lastCheckedAt, now, lastError);
    }

    public HealthState afterFailure(String error, Instant now) {
        return new HealthState(totalRequests + 1, failedRequests + 1, consecutiveFailures + 1, lastCheckedAt, now, error);
    }

    /**
     * Result of a health probe. Probes do not count as requests.
     *
     * @param success whether the probe passed
     * @param error   probe error when it failed
     * @param now     probe time
     * @return new state
     */
    public HealthState afterProbe(boolean success, String error, Instant now) {
        if (success) {
            return new HealthState(totalRequests, failedRequests, 0, now, lastUsedAt, lastError);
        }
        return new HealthState(totalRequests, failedRequests, consecutiveFailures, now, lastUsedAt, error);
    }
}
