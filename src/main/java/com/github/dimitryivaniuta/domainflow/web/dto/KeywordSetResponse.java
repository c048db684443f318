package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import java.util.List;

public record KeywordSetResponse(
        String keywordSetId,
        String name,
        String description,
        boolean enabled,
        List<Rule> rules
) {
    public record Rule(String pattern, String ruleType, double weight, boolean active) {}

    public static KeywordSetResponse from(KeywordSet s) {
        List<Rule> rules = s.getRules().stream()
                .map(r -> new Rule(r.getPattern(), r.getRuleType().name(), r.getWeight(), r.isActive()))
                .toList();
        return new KeywordSetResponse(s.getId(), s.getName(), s.getDescription(), s.isEnabled(), rules);
    }
}
