package com.github.dimitryivaniuta.domainflow.domain;

import java.time.Instant;

/**
 * Common view of personas and proxies for the resource pool.
 */
public interface PooledResource {

    String getId();

    boolean isEnabled();

    ResourceHealth getHealth();

    void setUpdatedAt(Instant updatedAt);

    ResourceKind kind();
}
