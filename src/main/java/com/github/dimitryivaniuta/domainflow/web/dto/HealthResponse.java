package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.ResourceHealth;
import java.time.Instant;

/**
 * Health block of a persona or proxy.
 */
public record HealthResponse(
        boolean healthy,
        long totalRequests,
        long failedRequests,
        double successRate,
        int consecutiveFailures,
        Instant lastCheckedAt,
        Instant lastUsedAt,
        String lastError
) {
    public static HealthResponse from(ResourceHealth h) {
        return new HealthResponse(h.isHealthy(), h.getTotalRequests(), h.getFailedRequests(), h.getSuccessRate(),
                h.getConsecutiveFailures(), h.getLastCheckedAt(), h.getLastUsedAt(), h.getLastError());
    }
}
