package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import java.util.List;
import java.util.function.Function;

/**
 * Same domain, same resource, as long as the candidate list is the same.
 */
public class StickyPerDomainSelector<T extends PooledResource> implements ResourceSelector<T> {

    @Override
    public T select(List<T> candidates, String domain, Function<T, HealthState> health) {
        int i = Math.floorMod(domain == null ? 0 : domain.hashCode(), candidates.size());
        return candidates.get(i);
    }
}
