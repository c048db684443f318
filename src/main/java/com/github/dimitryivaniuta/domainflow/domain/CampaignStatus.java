package com.github.dimitryivaniuta.domainflow.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Campaign lifecycle status.
 *
 * <p>Allowed transitions:
 * <pre>
 * PENDING   -> QUEUED, CANCELLED
 * QUEUED    -> RUNNING, PAUSED, CANCELLED, FAILED
 * RUNNING   -> PAUSED, COMPLETED, FAILED
 * PAUSED    -> RUNNING, QUEUED, CANCELLED, FAILED
 * COMPLETED -> ARCHIVED
 * FAILED    -> QUEUED, ARCHIVED
 * </pre>
 * CANCELLED and ARCHIVED accept no further transitions.</p>
 */
public enum CampaignStatus {
    PENDING,
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED,
    ARCHIVED;

    /**
     * Returns the statuses reachable from this one.
     *
     * @return allowed targets (mutable copy)
     */
    public Set<CampaignStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(QUEUED, CANCELLED);
            case QUEUED:
                return EnumSet.of(RUNNING, PAUSED, CANCELLED, FAILED);
            case RUNNING:
                return EnumSet.of(PAUSED, COMPLETED, FAILED);
            case PAUSED:
                return EnumSet.of(RUNNING, QUEUED, CANCELLED, FAILED);
            case COMPLETED:
                return EnumSet.of(ARCHIVED);
            case FAILED:
                return EnumSet.of(QUEUED, ARCHIVED);
            default:
                return EnumSet.noneOf(CampaignStatus.class);
        }
    }

    public boolean canTransitionTo(CampaignStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * Terminal means the campaign will not produce further work: completed, failed or cancelled.
     *
     * @return true for terminal statuses
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == ARCHIVED;
    }
}
