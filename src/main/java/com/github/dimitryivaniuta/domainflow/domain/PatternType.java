package com.github.dimitryivaniuta.domainflow.domain;

import java.util.Locale;

/**
 * Where the variable part sits relative to the constant string.
 */
public enum PatternType {
    /** {@code <variable><constant>.<tld>} */
    PREFIX,
    /** {@code <constant><variable>.<tld>} */
    SUFFIX,
    /** {@code <variable><constant><variable>.<tld>}, each variable part of the configured length. */
    BOTH;

    /**
     * Parses a pattern type name, case-insensitively.
     *
     * @param value raw name
     * @return pattern type, or {@code null} when unknown
     */
    public static PatternType parse(String value) {
        if (value == null) {
            return null;
        }
        try {
            return PatternType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
