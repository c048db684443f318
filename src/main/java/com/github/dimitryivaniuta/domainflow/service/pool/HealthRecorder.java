package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.ResourceKind;

/**
 * Persists the outcome of one request made through a pooled resource.
 */
@FunctionalInterface
public interface HealthRecorder {

    void record(ResourceKind kind, String resourceId, boolean success, String error);
}
