package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Generation parameters of one campaign. The pattern fields are stored normalised and point at the
 * shared {@link GenerationConfig} through {@code configFingerprint}.
 */
@Entity
@Table(name = "domain_generation_params")
@Getter
@Setter
@NoArgsConstructor
public class DomainGenerationParams {

    @Id
    @Column(name = "campaign_id", nullable = false, updatable = false, length = 36)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, length = 16)
    private PatternType patternType;

    @Column(name = "character_set", nullable = false, length = 512)
    private String characterSet;

    @Column(name = "constant_string", nullable = false, length = 255)
    private String constantString;

    @Column(name = "variable_length", nullable = false)
    private int variableLength;

    @Column(name = "tld", nullable = false, length = 64)
    private String tld;

    @Column(name = "num_domains_to_generate", nullable = false)
    private long numDomainsToGenerate;

    @Column(name = "batch_size", nullable = false)
    private int batchSize;

    @Column(name = "config_fingerprint", nullable = false, length = 64)
    private String configFingerprint;

    @Column(name = "generated_count", nullable = false)
    private long generatedCount;

    /**
     * Rolling generation rate in domains per second.
     */
    @Column(name = "generation_rate_per_second")
    private Double generationRatePerSecond;

    public GenerationSpec toSpec() {
        return new GenerationSpec(patternType, characterSet, constantString, variableLength, tld);
    }

    public long remaining() {
        return Math.max(0L, numDomainsToGenerate - generatedCount);
    }
}
