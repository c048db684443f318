package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Validation status carried by a generated domain row.
 */
public enum DomainValidationStatus {
    PENDING,
    VALID,
    INVALID,
    ERROR,
    SKIPPED
}
