package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Business outcome of an HTTP keyword check.
 */
public enum HttpValidationStatus {
    KEYWORDS_FOUND,
    NO_KEYWORDS,
    /** 401, 403, 407 or 451. */
    ACCESS_DENIED,
    /** Status code outside the persona's allowed list. */
    UNEXPECTED_STATUS,
    /** Every attempt failed at the transport level. */
    UNREACHABLE
}
