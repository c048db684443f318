package com.github.dimitryivaniuta.domainflow.domain;

import java.util.List;

/**
 * Which URL schemes an HTTP keyword check tries, in order.
 */
public enum HttpSchemePolicy {
    /** https, then http when https gets no response. */
    HTTPS_FIRST(List.of("https", "http")),
    HTTPS_ONLY(List.of("https")),
    HTTP_ONLY(List.of("http"));

    private final List<String> schemes;

    HttpSchemePolicy(List<String> schemes) {
        this.schemes = schemes;
    }

    public List<String> schemes() {
        return schemes;
    }
}
