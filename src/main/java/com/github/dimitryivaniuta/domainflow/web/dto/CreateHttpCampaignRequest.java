package com.github.dimitryivaniuta.domainflow.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Request payload for an HTTP keyword validation campaign. Null numeric fields take defaults.
 *
 * @param sourceType               {@code DomainGeneration} or {@code DNSValidation}; must match the source campaign
 * @param processingSpeedPerMinute checks per minute, 0 or null for unlimited
 * @param schemePolicy             {@code HTTPS_FIRST} (default), {@code HTTPS_ONLY} or {@code HTTP_ONLY}
 * @param targetHttpPorts          ports to try, empty or null for the scheme defaults
 */
public record CreateHttpCampaignRequest(
        @NotBlank String name,
        @NotBlank String sourceCampaignId,
        @NotBlank String sourceType,
        @NotEmpty List<String> personaIds,
        List<String> proxyIds,
        List<String> keywordSetIds,
        List<String> adHocKeywords,
        String selectionStrategy,
        Integer rotationIntervalSeconds,
        Integer batchSize,
        Integer retryAttempts,
        Integer parallelWorkers,
        Boolean followRedirects,
        Integer maxRedirects,
        Integer requestTimeoutSeconds,
        @PositiveOrZero Integer processingSpeedPerMinute,
        String schemePolicy,
        List<@NotNull @Min(1) @Max(65535) Integer> targetHttpPorts
) {}
