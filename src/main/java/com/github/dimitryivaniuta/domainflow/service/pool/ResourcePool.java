package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import com.github.dimitryivaniuta.domainflow.service.error.ResourcePoolExhaustedException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rotation over one campaign's personas or proxies for the duration of a batch.
 *
 * <p>Health is mirrored in memory so that a circuit opened by one domain's failures is respected by
 * the rest of the batch immediately; every outcome is also handed to the {@link HealthRecorder}
 * for persistence. The rotation rest period starts from the persisted {@code last_used_at}, so a
 * new pool for the next batch still skips resources used moments ago.</p>
 *
 * @param <T> persona or proxy
 */
public class ResourcePool<T extends PooledResource> {

    private final String label;
    private final List<T> members;
    private final Map<String, HealthState> health = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSelectedAt = new ConcurrentHashMap<>();
    private final CircuitBreaker breaker;
    private final ResourceSelector<T> selector;
    private final Duration rotationInterval;
    private final HealthRecorder recorder;
    private final Clock clock;

    /**
     * Creates a pool.
     *
     * @param label            name used in errors and logs
     * @param members          enabled resources
     * @param breaker          circuit breaker
     * @param selector         selection strategy
     * @param rotationInterval rest period after a resource is selected; zero disables forced rotation
     * @param recorder         outcome persistence
     * @param clock            time source
     */
    public ResourcePool(String label, List<T> members, CircuitBreaker breaker, ResourceSelector<T> selector,
                        Duration rotationInterval, HealthRecorder recorder, Clock clock) {
        this.label = label;
        this.members = new ArrayList<>(members);
        this.members.sort(Comparator.comparing(PooledResource::getId));
        this.breaker = breaker;
        this.selector = selector;
        this.rotationInterval = rotationInterval == null ? Duration.ZERO : rotationInterval;
        this.recorder = recorder;
        this.clock = clock;
        for (T m : this.members) {
            HealthState state = m.getHealth().toState();
            health.put(m.getId(), state);
            // rest periods carry over from earlier batches through the persisted last use
            if (state.lastUsedAt() != null) {
                lastSelectedAt.put(m.getId(), state.lastUsedAt());
            }
        }
    }

    /**
     * Selects a resource for {@code domain}.
     *
     * @param domain  domain being checked
     * @param exclude ids used by earlier attempts on this domain; ignored if nothing else is left
     * @return selected resource
     * @throws ResourcePoolExhaustedException when every resource's circuit is open
     */
    public synchronized T acquire(String domain, Set<String> exclude) {
        List<T> active = active();
        if (active.isEmpty()) {
            throw new ResourcePoolExhaustedException("No usable " + label + ": all " + members.size() + " excluded by circuit breaker");
        }
        List<T> candidates = new ArrayList<>(active);
        if (exclude != null && !exclude.isEmpty()) {
            candidates.removeIf(r -> exclude.contains(r.getId()));
            if (candidates.isEmpty()) {
                candidates = new ArrayList<>(active);
            }
        }
        Instant now = clock.instant();
        if (!rotationInterval.isZero()) {
            List<T> rested = new ArrayList<>();
            for (T r : candidates) {
                Instant last = lastSelectedAt.get(r.getId());
                if (last == null || !last.plus(rotationInterval).isAfter(now)) {
                    rested.add(r);
                }
            }
            if (!rested.isEmpty()) {
                candidates = rested;
            }
        }
        T chosen = selector.select(candidates, domain, this::healthOf);
        lastSelectedAt.put(chosen.getId(), now);
        return chosen;
    }

    public void recordSuccess(T resource) {
        Instant now = clock.instant();
        health.computeIfPresent(resource.getId(), (id, s) -> s.afterSuccess(now));
        recorder.record(resource.kind(), resource.getId(), true, null);
    }

    public void recordFailure(T resource, String error) {
        Instant now = clock.instant();
        health.computeIfPresent(resource.getId(), (id, s) -> s.afterFailure(error, now));
        recorder.record(resource.kind(), resource.getId(), false, error);
    }

    public List<T> active() {
        List<T> out = new ArrayList<>();
        for (T m : members) {
            if (!breaker.isOpen(healthOf(m))) {
                out.add(m);
            }
        }
        return out;
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public HealthState healthOf(T resource) {
        return health.getOrDefault(resource.getId(), HealthState.fresh());
    }

    public String getLabel() {
        return label;
    }
}
