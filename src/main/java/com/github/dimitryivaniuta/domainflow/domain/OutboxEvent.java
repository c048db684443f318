package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Campaign notification waiting to be published to Kafka.
 *
 * <p>Written in the same transaction as the counter or status change it describes, so a
 * notification exists if and only if the change committed. {@code OutboxDispatcher} drains the
 * table.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = {
                @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "campaign_id", nullable = false, length = 36)
    private String campaignId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates a NEW event keyed by campaign, so one campaign's events stay ordered on a partition.
     *
     * @param campaignId campaign id, also the Kafka key
     * @param eventType  notification type, e.g. {@code campaign.progress}
     * @param payload    JSON message
     * @return event
     */
    public static OutboxEvent newEvent(String campaignId, String eventType, String payload) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.campaignId = campaignId;
        e.eventType = eventType;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.createdAt = Instant.now();
        e.updatedAt = e.createdAt;
        return e;
    }

    public void markSent() {
        this.status = OutboxStatus.SENT;
        this.sentAt = Instant.now();
        this.updatedAt = this.sentAt;
        this.nextAttemptAt = null;
        this.lastError = null;
    }

    /**
     * Schedules another send attempt.
     *
     * @param error   send error
     * @param backoff delay before the next attempt
     */
    public void markRetry(String error, Duration backoff) {
        Instant now = Instant.now();
        this.status = OutboxStatus.RETRY;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = now.plus(backoff);
        this.updatedAt = now;
    }

    public void markDead(String error) {
        this.status = OutboxStatus.DEAD;
        this.attemptCount++;
        this.lastError = error;
        this.nextAttemptAt = null;
        this.updatedAt = Instant.now();
    }
}
