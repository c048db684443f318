package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Unit of schedulable campaign work, leased to one worker at a time.
 *
 * <p>Status flow: {@code PENDING -> LOCKED -> RUNNING -> COMPLETED | FAILED | RETRY_PENDING},
 * with {@code RETRY_PENDING -> PENDING} once {@code nextExecutionAt} passes. Lock fields are only
 * written through the conditional updates in
 * {@link com.github.dimitryivaniuta.domainflow.repo.CampaignJobRepository}.</p>
 */
@Entity
@Table(
        name = "campaign_jobs",
        indexes = {
                @Index(name = "idx_campaign_jobs_claim", columnList = "status,next_execution_at,priority"),
                @Index(name = "idx_campaign_jobs_campaign", columnList = "campaign_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class CampaignJob {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 36)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, updatable = false, length = 32)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    /**
     * 1..10, higher first.
     */
    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "locked_by", length = 128)
    private String lockedBy;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "next_execution_at", nullable = false)
    private Instant nextExecutionAt;

    @Column(name = "last_attempted_at")
    private Instant lastAttemptedAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "processing_server_id", length = 128)
    private String processingServerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a pending job runnable at {@code runAt}.
     *
     * @param campaignId     campaign id
     * @param jobType        job type
     * @param priority       priority 1..10
     * @param maxAttempts    attempts before permanent failure
     * @param timeoutSeconds lease duration
     * @param runAt          earliest execution time
     * @return job
     */
    public static CampaignJob pending(String campaignId, JobType jobType, int priority, int maxAttempts,
                                      int timeoutSeconds, Instant runAt) {
        CampaignJob j = new CampaignJob();
        j.id = UUID.randomUUID().toString();
        j.campaignId = campaignId;
        j.jobType = jobType;
        j.status = JobStatus.PENDING;
        j.priority = Math.max(1, Math.min(10, priority));
        j.maxAttempts = maxAttempts;
        j.timeoutSeconds = timeoutSeconds;
        j.scheduledAt = runAt;
        j.nextExecutionAt = runAt;
        j.createdAt = Instant.now();
        j.updatedAt = j.createdAt;
        return j;
    }

    /**
     * Whether the lease has outlived {@code timeoutSeconds}.
     *
     * @param now current time
     * @return true for LOCKED/RUNNING jobs with a stale lock
     */
    public boolean isLeaseExpired(Instant now) {
        if (status != JobStatus.LOCKED && status != JobStatus.RUNNING) {
            return false;
        }
        return lockedAt != null && lockedAt.plusSeconds(timeoutSeconds).isBefore(now);
    }
}
