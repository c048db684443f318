package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Shared enumeration cursor for one set of normalised generation parameters.
 *
 * <p>Keyed by the parameter fingerprint so identical requests, across campaigns and restarts, resume
 * from the same offset. Rows are never deleted and {@code currentOffset} only moves forward through
 * the conditional update in
 * {@link com.github.dimitryivaniuta.domainflow.repo.GenerationConfigRepository#advanceOffset}.</p>
 */
@Entity
@Table(name = "generation_configs")
@Getter
@Setter
@NoArgsConstructor
public class GenerationConfig {

    @Id
    @Column(name = "fingerprint", nullable = false, updatable = false, length = 64)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(name = "pattern_type", nullable = false, updatable = false, length = 16)
    private PatternType patternType;

    @Column(name = "character_set", nullable = false, updatable = false, length = 512)
    private String characterSet;

    @Column(name = "constant_string", nullable = false, updatable = false, length = 255)
    private String constantString;

    @Column(name = "variable_length", nullable = false, updatable = false)
    private int variableLength;

    @Column(name = "tld", nullable = false, updatable = false, length = 64)
    private String tld;

    @Column(name = "total_possible_combinations", nullable = false, updatable = false)
    private long totalPossibleCombinations;

    @Column(name = "current_offset", nullable = false)
    private long currentOffset;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a fresh cursor at offset 0.
     *
     * @param fingerprint parameter fingerprint
     * @param spec normalised parameters
     * @param capacity total possible combinations
     * @return config row
     */
    public static GenerationConfig fresh(String fingerprint, GenerationSpec spec, long capacity) {
        GenerationConfig g = new GenerationConfig();
        g.fingerprint = fingerprint;
        g.patternType = spec.patternType();
        g.characterSet = spec.characterSet();
        g.constantString = spec.constantString();
        g.variableLength = spec.variableLength();
        g.tld = spec.tld();
        g.totalPossibleCombinations = capacity;
        g.currentOffset = 0L;
        g.createdAt = Instant.now();
        g.updatedAt = g.createdAt;
        return g;
    }

    public GenerationSpec toSpec() {
        return new GenerationSpec(patternType, characterSet, constantString, variableLength, tld);
    }

    public boolean isExhausted() {
        return currentOffset >= totalPossibleCombinations;
    }
}
