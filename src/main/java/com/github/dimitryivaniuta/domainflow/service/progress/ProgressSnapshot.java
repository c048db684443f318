package com.github.dimitryivaniuta.domainflow.service.progress;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import java.time.Instant;

/**
 * Read-only view of a campaign's progress, as pushed to the notifier and served by the API.
 */
public record ProgressSnapshot(
        String campaignId,
        String name,
        CampaignType type,
        CampaignStatus status,
        long totalItems,
        long processedItems,
        long successfulItems,
        long failedItems,
        double progressPercentage,
        Double avgProcessingRate,
        Instant estimatedCompletionAt,
        Instant lastHeartbeatAt,
        boolean degraded,
        String errorMessage
) {

    public static ProgressSnapshot from(Campaign c) {
        return new ProgressSnapshot(
                c.getId(),
                c.getName(),
                c.getType(),
                c.getStatus(),
                c.getTotalItems(),
                c.getProcessedItems(),
                c.getSuccessfulItems(),
                c.getFailedItems(),
                c.getProgressPercentage(),
                c.getAvgProcessingRate(),
                c.getEstimatedCompletionAt(),
                c.getLastHeartbeatAt(),
                c.isDegraded(),
                c.getErrorMessage()
        );
    }
}
