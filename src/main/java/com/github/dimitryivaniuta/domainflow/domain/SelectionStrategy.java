package com.github.dimitryivaniuta.domainflow.domain;

import java.util.Locale;

/**
 * Resource selection strategy configured per campaign pool.
 */
public enum SelectionStrategy {
    ROUND_ROBIN,
    WEIGHTED_SUCCESS_RATE,
    STICKY_PER_DOMAIN;

    /**
     * Parses a strategy name; blank means round-robin.
     *
     * @param value raw value, e.g. {@code round-robin}
     * @return strategy, or {@code null} when unknown
     */
    public static SelectionStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return ROUND_ROBIN;
        }
        try {
            return SelectionStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
