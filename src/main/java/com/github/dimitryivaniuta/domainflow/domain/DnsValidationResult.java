package com.github.dimitryivaniuta.domainflow.domain;

import com.github.dimitryivaniuta.domainflow.domain.converter.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of validating one domain over DNS.
 */
@Entity
@Table(
        name = "dns_validation_results",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_dns_results_campaign_domain", columnNames = {"campaign_id", "domain_name"})
        },
        indexes = {
                @Index(name = "idx_dns_results_campaign_status", columnList = "campaign_id,dns_status")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class DnsValidationResult {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "campaign_id", nullable = false, updatable = false, length = 36)
    private String campaignId;

    @Column(name = "domain_name", nullable = false, updatable = false, length = 253)
    private String domainName;

    @Enumerated(EnumType.STRING)
    @Column(name = "system_status", nullable = false, length = 16)
    private SystemStatus systemStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "dns_status", nullable = false, length = 16)
    private DnsValidationStatus dnsStatus;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "resolved_addresses", nullable = false, columnDefinition = "text")
    private List<String> resolvedAddresses = new ArrayList<>();

    @Column(name = "resolver", length = 255)
    private String resolver;

    @Column(name = "persona_id", length = 36)
    private String personaId;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "checked_at", nullable = false)
    private Instant checkedAt;

    public static DnsValidationResult newResult(String campaignId, String domainName) {
        DnsValidationResult r = new DnsValidationResult();
        r.id = UUID.randomUUID().toString();
        r.campaignId = campaignId;
        r.domainName = domainName;
        r.checkedAt = Instant.now();
        return r;
    }
}
