package com.github.dimitryivaniuta.domainflow.domain;

import java.util.Arrays;

/**
 * Pipeline stage a campaign belongs to.
 *
 * <p>The {@code sourceTypeName} is the external name used when a campaign declares the type of its
 * predecessor ({@code DomainGeneration}, {@code DNSValidation}).</p>
 */
public enum CampaignType {
    /** Combinatorial domain generation. */
    DOMAIN_GENERATION("DomainGeneration"),
    /** DNS resolution of a predecessor's domains. */
    DNS_VALIDATION("DNSValidation"),
    /** HTTP fetch plus keyword evaluation of a predecessor's domains. */
    HTTP_KEYWORD_VALIDATION("HTTPKeywordValidation");

    private final String sourceTypeName;

    CampaignType(String sourceTypeName) {
        this.sourceTypeName = sourceTypeName;
    }

    public String getSourceTypeName() {
        return sourceTypeName;
    }

    /**
     * Resolves a declared source type by its external name (case-insensitive) or enum constant name.
     *
     * @param name declared name
     * @return type, or {@code null} when the name is unknown
     */
    public static CampaignType fromSourceTypeName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.sourceTypeName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(null);
    }
}
