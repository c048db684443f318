package com.github.dimitryivaniuta.domainflow.domain;

import com.github.dimitryivaniuta.domainflow.domain.converter.IntegerListJsonConverter;
import com.github.dimitryivaniuta.domainflow.domain.converter.StringListJsonConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * HTTP keyword validation parameters.
 */
@Entity
@Table(name = "http_keyword_params")
@Getter
@Setter
@NoArgsConstructor
public class HttpKeywordParams extends ValidationParams {

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "proxy_ids", nullable = false, columnDefinition = "text")
    private List<String> proxyIds = new ArrayList<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "keyword_set_ids", nullable = false, columnDefinition = "text")
    private List<String> keywordSetIds = new ArrayList<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "ad_hoc_keywords", nullable = false, columnDefinition = "text")
    private List<String> adHocKeywords = new ArrayList<>();

    @Column(name = "follow_redirects", nullable = false)
    private boolean followRedirects = true;

    @Column(name = "max_redirects", nullable = false)
    private int maxRedirects = 5;

    @Enumerated(EnumType.STRING)
    @Column(name = "scheme_policy", nullable = false, length = 16)
    private HttpSchemePolicy schemePolicy = HttpSchemePolicy.HTTPS_FIRST;

    /**
     * Ports to try on the target; empty means the scheme's default port.
     */
    @Convert(converter = IntegerListJsonConverter.class)
    @Column(name = "target_http_ports", nullable = false, columnDefinition = "text")
    private List<Integer> targetHttpPorts = new ArrayList<>();

    @Override
    public List<String> proxyIdsOrEmpty() {
        return proxyIds == null ? List.of() : proxyIds;
    }
}
