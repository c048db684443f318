package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A campaign is one stage of the pipeline: generation, DNS validation or HTTP keyword validation.
 *
 * <p>Validation campaigns reference their predecessor by id and declare its type. Counters are the
 * authoritative progress figures and are only changed through
 * {@link com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator}, which keeps
 * {@code processed <= total} and {@code successful + failed <= processed}.</p>
 */
@Entity
@Table(
        name = "campaigns",
        indexes = {
                @Index(name = "idx_campaigns_status", columnList = "status"),
                @Index(name = "idx_campaigns_source", columnList = "source_campaign_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Campaign {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "campaign_type", nullable = false, updatable = false, length = 32)
    private CampaignType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CampaignStatus status;

    @Column(name = "source_campaign_id", length = 36, updatable = false)
    private String sourceCampaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 32, updatable = false)
    private CampaignType sourceType;

    @Column(name = "total_items", nullable = false)
    private long totalItems;

    @Column(name = "processed_items", nullable = false)
    private long processedItems;

    @Column(name = "successful_items", nullable = false)
    private long successfulItems;

    @Column(name = "failed_items", nullable = false)
    private long failedItems;

    @Column(name = "progress_percentage", nullable = false)
    private double progressPercentage;

    @Column(name = "avg_processing_rate")
    private Double avgProcessingRate;

    @Column(name = "estimated_completion_at")
    private Instant estimatedCompletionAt;

    @Column(name = "last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @Column(name = "degraded", nullable = false)
    private boolean degraded;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Creates a pending campaign.
     *
     * @param name display name
     * @param type stage type
     * @param sourceCampaignId predecessor id (validation stages only)
     * @param sourceType declared predecessor type (validation stages only)
     * @return campaign
     */
    public static Campaign newPending(String name, CampaignType type, String sourceCampaignId, CampaignType sourceType) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");

        Campaign c = new Campaign();
        c.id = UUID.randomUUID().toString();
        c.name = name;
        c.type = type;
        c.status = CampaignStatus.PENDING;
        c.sourceCampaignId = sourceCampaignId;
        c.sourceType = sourceType;
        c.createdAt = Instant.now();
        c.updatedAt = c.createdAt;
        return c;
    }

    /**
     * Applies a lifecycle transition, stamping start/completion times.
     *
     * @param target new status
     * @throws IllegalStateException when the transition is not allowed
     */
    public void transitionTo(CampaignStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid campaign transition " + status + " -> " + target);
        }
        Instant now = Instant.now();
        if (target == CampaignStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (target.isTerminal() && target != CampaignStatus.ARCHIVED) {
            completedAt = now;
        }
        this.status = target;
        this.updatedAt = now;
    }

    public boolean isValidationStage() {
        return type != CampaignType.DOMAIN_GENERATION;
    }
}
