package com.github.dimitryivaniuta.domainflow.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A domain emitted by a generation campaign at a given enumeration offset.
 */
@Entity
@Table(
        name = "generated_domains",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_generated_domains_campaign_name", columnNames = {"campaign_id", "domain_name"})
        },
        indexes = {
                @Index(name = "idx_generated_domains_campaign_offset", columnList = "campaign_id,offset_index")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class GeneratedDomain {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 36)
    private String campaignId;

    @Column(name = "domain_name", nullable = false, updatable = false, length = 253)
    private String domainName;

    @Column(name = "offset_index", nullable = false, updatable = false)
    private long offsetIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 16)
    private DomainValidationStatus validationStatus;

    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    public static GeneratedDomain of(String campaignId, String domainName, long offsetIndex) {
        GeneratedDomain d = new GeneratedDomain();
        d.id = UUID.randomUUID().toString();
        d.campaignId = campaignId;
        d.domainName = domainName;
        d.offsetIndex = offsetIndex;
        d.validationStatus = DomainValidationStatus.PENDING;
        d.generatedAt = Instant.now();
        return d;
    }
}
