package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Whether the final attempt for a domain executed without a transport or infrastructure failure.
 * Independent of the business outcome.
 */
public enum SystemStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
