package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.GenerationConfig;
import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.repo.GenerationConfigRepository;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable enumeration cursors keyed by config fingerprint.
 *
 * <p>Both operations commit in their own transaction. A reserved range is consumed the moment
 * {@link #reserve} returns, whatever happens to the caller's batch afterwards: a crash may leave a
 * gap in the offsets but can never hand the same offset out twice.</p>
 */
@Service
public class GenerationCursorStore {

    private static final Logger log = LoggerFactory.getLogger(GenerationCursorStore.class);

    private final GenerationConfigRepository repository;
    private final TransactionTemplate requiresNew;
    private final AppProperties properties;

    public GenerationCursorStore(GenerationConfigRepository repository,
                                 PlatformTransactionManager transactionManager,
                                 AppProperties properties) {
        this.repository = repository;
        this.properties = properties;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Returns the cursor for {@code fingerprint}, creating it at offset 0 on first use.
     *
     * <p>When two callers create the same fingerprint concurrently the first insert wins and the loser
     * adopts the committed row.</p>
     *
     * @param fingerprint config fingerprint
     * @param spec        normalised spec
     * @param capacity    total combinations of {@code spec}
     * @return existing or new config
     */
    public GenerationConfig obtain(String fingerprint, GenerationSpec spec, long capacity) {
        GenerationConfig existing = requiresNew.execute(status -> repository.findById(fingerprint).orElse(null));
        if (existing != null) {
            return existing;
        }
        try {
            GenerationConfig created = requiresNew.execute(status ->
                    repository.saveAndFlush(GenerationConfig.fresh(fingerprint, spec, capacity)));
            log.info("Created generation config fingerprint={} capacity={}", fingerprint, capacity);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.debug("Generation config {} created concurrently, adopting existing row", fingerprint);
            return requiresNew.execute(status -> repository.findById(fingerprint))
                    .orElseThrow(() -> new IllegalStateException("Generation config vanished: " + fingerprint, e));
        }
    }

    /**
     * Atomically reserves up to {@code size} offsets.
     *
     * @param fingerprint config fingerprint
     * @param size        requested range size
     * @return reserved range, clipped at capacity; empty once the config is exhausted
     */
    public OffsetRange reserve(String fingerprint, long size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        int maxRetries = properties.getGeneration().getMaxCursorCasRetries();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                OffsetRange range = requiresNew.execute(status -> tryReserve(fingerprint, size));
                if (range != null) {
                    return range;
                }
            } catch (DataAccessException | TransactionException e) {
                log.debug("Cursor reservation on {} hit a conflict (attempt {}): {}", fingerprint, attempt, e.getMessage());
            }
        }
        throw new IllegalStateException("Could not reserve a range on " + fingerprint + " after " + maxRetries + " attempts");
    }

    /**
     * Current offset, for monitoring.
     *
     * @param fingerprint config fingerprint
     * @return offset
     */
    public long currentOffset(String fingerprint) {
        return requiresNew.execute(status -> repository.findById(fingerprint)
                .map(GenerationConfig::getCurrentOffset)
                .orElseThrow(() -> new IllegalArgumentException("Unknown generation config " + fingerprint)));
    }

    private OffsetRange tryReserve(String fingerprint, long size) {
        GenerationConfig config = repository.findById(fingerprint)
                .orElseThrow(() -> new IllegalArgumentException("Unknown generation config " + fingerprint));
        long start = config.getCurrentOffset();
        long capacity = config.getTotalPossibleCombinations();
        if (start >= capacity) {
            return new OffsetRange(capacity, capacity);
        }
        long end = start + Math.min(size, capacity - start);
        int updated = repository.advanceOffset(fingerprint, start, end, Instant.now());
        return updated == 1 ? new OffsetRange(start, end) : null;
    }
}
