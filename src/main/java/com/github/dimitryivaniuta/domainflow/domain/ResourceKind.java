package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Kind of pooled resource.
 */
public enum ResourceKind {
    PERSONA,
    PROXY
}
