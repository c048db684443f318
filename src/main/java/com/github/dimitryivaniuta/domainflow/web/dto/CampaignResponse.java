package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import java.time.Instant;

/**
 * Campaign as returned by the API.
 */
public record CampaignResponse(
        String campaignId,
        String name,
        String type,
        String status,
        String sourceCampaignId,
        String sourceType,
        long totalItems,
        long processedItems,
        long successfulItems,
        long failedItems,
        double progressPercentage,
        boolean degraded,
        String errorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    /**
     * Maps a domain {@link Campaign} to an API response.
     *
     * @param c campaign entity
     * @return response
     */
    public static CampaignResponse from(Campaign c) {
        return new CampaignResponse(
                c.getId(),
                c.getName(),
                c.getType().getSourceTypeName(),
                c.getStatus().name(),
                c.getSourceCampaignId(),
                c.getSourceType() == null ? null : c.getSourceType().getSourceTypeName(),
                c.getTotalItems(),
                c.getProcessedItems(),
                c.getSuccessfulItems(),
                c.getFailedItems(),
                c.getProgressPercentage(),
                c.isDegraded(),
                c.getErrorMessage(),
                c.getCreatedAt(),
                c.getStartedAt(),
                c.getCompletedAt()
        );
    }
}
