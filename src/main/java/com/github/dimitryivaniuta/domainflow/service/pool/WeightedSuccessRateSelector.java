package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import java.util.List;
import java.util.Random;
import java.util.function.Function;

/**
 * Random choice weighted by success rate. Every candidate keeps a small floor weight so a resource
 * with a bad history can still recover.
 */
public class WeightedSuccessRateSelector<T extends PooledResource> implements ResourceSelector<T> {

    static final double MIN_WEIGHT = 0.01d;

    private final Random random;

    public WeightedSuccessRateSelector(Random random) {
        this.random = random;
    }

    @Override
    public T select(List<T> candidates, String domain, Function<T, HealthState> health) {
        double[] weights = new double[candidates.size()];
        double sum = 0.0d;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = Math.max(MIN_WEIGHT, health.apply(candidates.get(i)).successRate());
            sum += weights[i];
        }
        double r;
        synchronized (random) {
            r = random.nextDouble() * sum;
        }
        for (int i = 0; i < weights.length; i++) {
            r -= weights[i];
            if (r < 0) {
                return candidates.get(i);
            }
        }
        return candidates.get(candidates.size() - 1);
    }
}
