package com.github.dimitryivaniuta.domainflow.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request payload for a keyword set.
 */
public record CreateKeywordSetRequest(
        @NotBlank String name,
        String description,
        @NotEmpty List<@Valid KeywordRuleRequest> rules
) {

    /**
     * @param ruleType {@code string}, {@code regex} or {@code case_insensitive}
     * @param weight   score contribution, default 1.0
     */
    public record KeywordRuleRequest(
            @NotBlank String pattern,
            @NotBlank String ruleType,
            Double weight,
            Boolean active
    ) {}
}
