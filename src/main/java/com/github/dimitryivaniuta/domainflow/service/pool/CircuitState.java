package com.github.dimitryivaniuta.domainflow.service.pool;

public enum CircuitState {
    /** Selectable. */
    CLOSED,
    /** Excluded; waiting for the probe interval to pass. */
    OPEN,
    /** Excluded; due for a health probe. */
    HALF_OPEN
}
