package com.github.dimitryivaniuta.domainflow.domain;

/**
 * How a keyword rule pattern is matched.
 */
public enum KeywordRuleType {
    /** Exact, case-sensitive substring. */
    STRING,
    REGEX,
    /** Substring, ignoring case. */
    CASE_INSENSITIVE
}
