package com.github.dimitryivaniuta.domainflow.domain;

import com.github.dimitryivaniuta.domainflow.domain.converter.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Parameters shared by the DNS and HTTP validation stages.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class ValidationParams {

    @Id
    @Column(name = "campaign_id", nullable = false, updatable = false, length = 36)
    private String campaignId;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "persona_ids", nullable = false, columnDefinition = "text")
    private List<String> personaIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "selection_strategy", nullable = false, length = 32)
    private SelectionStrategy selectionStrategy = SelectionStrategy.ROUND_ROBIN;

    /**
     * Seconds a resource rests after use; 0 disables forced rotation.
     */
    @Column(name = "rotation_interval_seconds", nullable = false)
    private int rotationIntervalSeconds;

    @Column(name = "batch_size", nullable = false)
    private int batchSize;

    @Column(name = "retry_attempts", nullable = false)
    private int retryAttempts;

    @Column(name = "parallel_workers", nullable = false)
    private int parallelWorkers;

    @Column(name = "request_timeout_seconds", nullable = false)
    private int requestTimeoutSeconds;

    /**
     * Checks per minute for the whole campaign on one instance; 0 is unlimited.
     */
    @Column(name = "processing_speed_per_minute", nullable = false)
    private int processingSpeedPerMinute;

    /**
     * Proxy ids to route through; empty for DNS or direct HTTP.
     *
     * @return proxy ids
     */
    public List<String> proxyIdsOrEmpty() {
        return List.of();
    }
}
