package com.github.dimitryivaniuta.domainflow.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request payload for a domain generation campaign.
 *
 * @param patternType          {@code prefix}, {@code suffix} or {@code both}
 * @param characterSet         characters of the variable part
 * @param constantString       fixed part of the label, may be empty
 * @param variableLength       length of each variable part
 * @param tld                  top-level domain, with or without leading dot
 * @param numDomainsToGenerate target count
 * @param batchSize            offsets reserved per job execution; null for the configured default
 */
public record CreateGenerationCampaignRequest(
        @NotBlank String name,
        @NotBlank String patternType,
        @NotBlank String characterSet,
        @NotNull String constantString,
        @Positive int variableLength,
        @NotBlank String tld,
        @Positive long numDomainsToGenerate,
        @Positive Integer batchSize
) {}
