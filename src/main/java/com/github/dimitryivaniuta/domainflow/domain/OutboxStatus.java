package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Delivery status of a campaign event waiting in the outbox.
 *
 * <p>Stored as VARCHAR; values are enforced in code.</p>
 */
public enum OutboxStatus {
    /** Written alongside a state change, never sent. */
    NEW,
    /** Send failed; eligible again after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    SENT,
    /** Gave up after the configured number of attempts. */
    DEAD
}
