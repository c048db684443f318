package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public class RoundRobinSelector<T extends PooledResource> implements ResourceSelector<T> {

    private final AtomicInteger next = new AtomicInteger();

    @Override
    public T select(List<T> candidates, String domain, Function<T, HealthState> health) {
        int i = Math.floorMod(next.getAndIncrement(), candidates.size());
        return candidates.get(i);
    }
}
