package com.github.dimitryivaniuta.domainflow.service.pool;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.HealthState;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.PooledResource;
import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import com.github.dimitryivaniuta.domainflow.domain.ResourceKind;
import com.github.dimitryivaniuta.domainflow.domain.SelectionStrategy;
import com.github.dimitryivaniuta.domainflow.repo.PersonaRepository;
import com.github.dimitryivaniuta.domainflow.repo.ProxyRepository;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds per-batch {@link ResourcePool}s and persists resource health.
 *
 * <p>Health writes are last-writer-wins per resource: each outcome re-reads the row, applies the
 * pure transition and saves. Under heavy concurrency some increments may interleave, which only
 * makes the success rate approximate.</p>
 */
@Service
public class ResourcePoolManager {

    private static final Logger log = LoggerFactory.getLogger(ResourcePoolManager.class);

    private final PersonaRepository personaRepository;
    private final ProxyRepository proxyRepository;
    private final CircuitBreaker circuitBreaker;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final Random random = new Random();
    private final Counter circuitOpenedCounter;
    private final Counter circuitClosedCounter;

    public ResourcePoolManager(PersonaRepository personaRepository,
                               ProxyRepository proxyRepository,
                               AppProperties properties,
                               PlatformTransactionManager transactionManager,
                               MeterRegistry meterRegistry) {
        this.personaRepository = personaRepository;
        this.proxyRepository = proxyRepository;
        this.circuitBreaker = new CircuitBreaker(properties.getPool().getCircuitFailureThreshold(), properties.getPool().getProbeInterval());
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = Clock.systemUTC();
        this.circuitOpenedCounter = Counter.builder("domainflow.pool.circuit.opened").register(meterRegistry);
        this.circuitClosedCounter = Counter.builder("domainflow.pool.circuit.closed").register(meterRegistry);
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Pool of enabled personas of {@code type} among {@code ids}.
     *
     * @param ids              persona ids from the campaign
     * @param type             required persona type
     * @param strategy         selection strategy
     * @param rotationSeconds  forced rotation interval, 0 to disable
     * @return pool, possibly with no members
     */
    public ResourcePool<Persona> personaPool(List<String> ids, PersonaType type, SelectionStrategy strategy, int rotationSeconds) {
        List<Persona> members = personaRepository.findAllById(ids).stream()
                .filter(p -> p.isEnabled() && p.getPersonaType() == type)
                .toList();
        return new ResourcePool<>(type.name().toLowerCase(Locale.ROOT) + " personas", members, circuitBreaker,
                ResourceSelector.forStrategy(strategy, random), Duration.ofSeconds(rotationSeconds), this::recordOutcome, clock);
    }

    /**
     * Pool of enabled proxies among {@code ids}.
     */
    public ResourcePool<Proxy> proxyPool(List<String> ids, SelectionStrategy strategy, int rotationSeconds) {
        List<Proxy> members = proxyRepository.findAllById(ids).stream()
                .filter(Proxy::isEnabled)
                .toList();
        return new ResourcePool<>("proxies", members, circuitBreaker,
                ResourceSelector.forStrategy(strategy, random), Duration.ofSeconds(rotationSeconds), this::recordOutcome, clock);
    }

    /**
     * Checks that every id names an existing persona of {@code type}.
     *
     * @throws InvalidConfigException otherwise
     */
    public void requirePersonas(List<String> ids, PersonaType type) {
        if (ids == null || ids.isEmpty()) {
            throw new InvalidConfigException("At least one " + type.name() + " persona is required");
        }
        Map<String, Persona> found = personaRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Persona::getId, Function.identity()));
        for (String id : ids) {
            Persona p = found.get(id);
            if (p == null) {
                throw new InvalidConfigException("Unknown persona: " + id);
            }
            if (p.getPersonaType() != type) {
                throw new InvalidConfigException("Persona " + id + " is " + p.getPersonaType() + ", expected " + type);
            }
        }
    }

    /**
     * Checks that every id names an existing proxy.
     *
     * @throws InvalidConfigException otherwise
     */
    public void requireProxies(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        Set<String> found = new HashSet<>();
        proxyRepository.findAllById(ids).forEach(p -> found.add(p.getId()));
        for (String id : ids) {
            if (!found.contains(id)) {
                throw new InvalidConfigException("Unknown proxy: " + id);
            }
        }
    }

    /**
     * Persists one request outcome.
     *
     * @param kind       persona or proxy
     * @param resourceId resource id
     * @param success    whether the transport succeeded
     * @param error      transport error on failure
     */
    public void recordOutcome(ResourceKind kind, String resourceId, boolean success, String error) {
        Instant now = clock.instant();
        update(kind, resourceId, state -> success
                ? state.afterSuccess(now)
                : state.afterFailure(ErrorMessages.truncate(error), now));
    }

    /**
     * Persists a health probe result; a passing probe closes the circuit.
     */
    public void recordProbe(ResourceKind kind, String resourceId, boolean success, String error) {
        Instant now = clock.instant();
        update(kind, resourceId, state -> state.afterProbe(success, ErrorMessages.truncate(error), now));
    }

    /**
     * Open-circuit resources whose probe interval has passed.
     *
     * @return personas and proxies due for a probe
     */
    public List<PooledResource> dueForProbe() {
        Instant now = clock.instant();
        return tx.execute(status -> {
            List<PooledResource> due = new ArrayList<>();
            personaRepository.findOpenCircuits().stream()
                    .filter(p -> circuitBreaker.isProbeDue(p.getHealth().toState(), now))
                    .forEach(due::add);
            proxyRepository.findOpenCircuits().stream()
                    .filter(p -> circuitBreaker.isProbeDue(p.getHealth().toState(), now))
                    .forEach(due::add);
            return due;
        });
    }

    private void update(ResourceKind kind, String resourceId, Function<HealthState, HealthState> transition) {
        try {
            tx.executeWithoutResult(status -> {
                Optional<? extends PooledResource> found = kind == ResourceKind.PERSONA
                        ? personaRepository.findById(resourceId)
                        : proxyRepository.findById(resourceId);
                found.ifPresent(r -> applyTransition(r, transition));
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not persist health of {} {}: {}", kind, resourceId, e.getMessage());
        }
    }

    private void applyTransition(PooledResource resource, Function<HealthState, HealthState> transition) {
        HealthState before = resource.getHealth().toState();
        HealthState after = transition.apply(before);
        boolean wasOpen = circuitBreaker.isOpen(before);
        boolean open = circuitBreaker.isOpen(after);
        resource.getHealth().apply(after, !open);
        resource.setUpdatedAt(clock.instant());

        if (!wasOpen && open) {
            circuitOpenedCounter.increment();
            log.warn("Circuit opened for {} {} after {} consecutive failures: {}",
                    resource.kind(), resource.getId(), after.consecutiveFailures(), after.lastError());
        } else if (wasOpen && !open) {
            circuitClosedCounter.increment();
            log.info("{} {} passed health probe and re-entered rotation", resource.kind(), resource.getId());
        }
    }
}
