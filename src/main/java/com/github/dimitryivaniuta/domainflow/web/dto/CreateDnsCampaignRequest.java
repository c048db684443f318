package com.github.dimitryivaniuta.domainflow.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Request payload for a DNS validation campaign. Null numeric fields take defaults.
 *
 * @param processingSpeedPerMinute checks per minute, 0 or null for unlimited
 */
public record CreateDnsCampaignRequest(
        @NotBlank String name,
        @NotBlank String sourceCampaignId,
        String sourceType,
        @NotEmpty List<String> personaIds,
        String selectionStrategy,
        Integer rotationIntervalSeconds,
        Integer batchSize,
        Integer retryAttempts,
        Integer parallelWorkers,
        Integer requestTimeoutSeconds,
        @PositiveOrZero Integer processingSpeedPerMinute
) {}
