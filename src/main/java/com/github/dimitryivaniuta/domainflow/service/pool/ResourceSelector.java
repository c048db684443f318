package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import com.github.dimitryivaniuta.domainflow.domain.SelectionStrategy;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * Picks one resource among eligible candidates.
 *
 * @param <T> resource type
 */
public interface ResourceSelector<T extends PooledResource> {

    /**
     * Chooses a candidate.
     *
     * @param candidates non-empty, eligible resources in a stable order
     * @param domain     domain being checked
     * @param health     current health of each candidate
     * @return chosen resource
     */
    T select(List<T> candidates, String domain, Function<T, HealthState> health);

    static <T extends PooledResource> ResourceSelector<T> forStrategy(SelectionStrategy strategy, Random random) {
        switch (strategy) {
            case WEIGHTED_SUCCESS_RATE:
                return new WeightedSuccessRateSelector<>(random);
            case STICKY_PER_DOMAIN:
                return new StickyPerDomainSelector<>();
            case ROUND_ROBIN:
            default:
                return new RoundRobinSelector<>();
        }
    }
}
