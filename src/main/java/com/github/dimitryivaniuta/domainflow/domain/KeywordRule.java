package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One pattern of a keyword set.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class KeywordRule {

    @Column(name = "pattern", nullable = false, length = 512)
    private String pattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_type", nullable = false, length = 24)
    private KeywordRuleType ruleType;

    @Column(name = "weight", nullable = false)
    private double weight = 1.0d;

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
