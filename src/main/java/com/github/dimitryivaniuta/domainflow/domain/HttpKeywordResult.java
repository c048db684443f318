package com.github.dimitryivaniuta.domainflow.domain;

import com.github.dimitryivaniuta.domainflow.domain.converter.KeywordHitsJsonConverter;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of fetching one domain over HTTP and scanning it for keywords.
 */
@Entity
@Table(
        name = "http_keyword_results",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_http_results_campaign_domain", columnNames = {"campaign_id", "domain_name"})
        },
        indexes = {
                @Index(name = "idx_http_results_campaign_status", columnList = "campaign_id,http_status"),
                @Index(name = "idx_http_results_content_hash", columnList = "content_hash")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class HttpKeywordResult {

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
    @Column(name = "http_status", nullable = false, length = 24)
    private HttpValidationStatus httpStatus;

    @Column(name = "status_code")
    private Integer statusCode;

    @Column(name = "final_url", length = 2048)
    private String finalUrl;

    @Column(name = "redirect_count", nullable = false)
    private int redirectCount;

    @Column(name = "page_title", length = 512)
    private String pageTitle;

    @Column(name = "content_snippet", columnDefinition = "text")
    private String contentSnippet;

    @Column(name = "content_length", nullable = false)
    private long contentLength;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Convert(converter = KeywordHitsJsonConverter.class)
    @Column(name = "keywords_from_sets", nullable = false, columnDefinition = "text")
    private Map<String, List<String>> keywordsFromSets = new LinkedHashMap<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "ad_hoc_keywords_found", nullable = false, columnDefinition = "text")
    private List<String> adHocKeywordsFound = new ArrayList<>();

    @Column(name = "keyword_score", nullable = false)
    private double keywordScore;

    @Column(name = "persona_id", length = 36)
    private String personaId;

    @Column(name = "proxy_id", length = 36)
    private String proxyId;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "duration_ms", nullable = false)
    private long durationMs;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "checked_at", nullable = false)
    private Instant checkedAt;

    public static HttpKeywordResult newResult(String campaignId, String domainName) {
        HttpKeywordResult r = new HttpKeywordResult();
        r.id = UUID.randomUUID().toString();
        r.campaignId = campaignId;
        r.domainName = domainName;
        r.checkedAt = Instant.now();
        return r;
    }
}
