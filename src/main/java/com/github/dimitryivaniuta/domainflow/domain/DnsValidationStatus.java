package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Business outcome of a DNS check.
 */
public enum DnsValidationStatus {
    /** At least one address record was returned. */
    RESOLVED,
    /** The name does not exist or has no address records. */
    UNRESOLVED,
    /** Every attempt failed at the transport level. */
    ERROR
}
