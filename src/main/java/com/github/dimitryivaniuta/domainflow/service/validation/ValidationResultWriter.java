package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressDelta;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a batch of validation results and the matching counter update in one transaction.
 *
 * <p>Rows for domains that already have a result in the campaign are dropped before the insert, so a
 * batch replayed after a lease reclaim neither duplicates rows nor double-counts progress.</p>
 */
@Service
public class ValidationResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ValidationResultWriter.class);

    private final ProgressAggregator progressAggregator;

    public ValidationResultWriter(ProgressAggregator progressAggregator) {
        this.progressAggregator = progressAggregator;
    }

    /**
     * Persists {@code results}.
     *
     * @param campaignId    campaign id
     * @param results       one result per checked domain
     * @param store         stage persistence
     * @param eligibleTotal eligible rows produced by the source so far
     * @param elapsed       batch wall time
     * @param <R>           result entity
     * @return number of rows written
     */
    @Transactional
    public <R> int write(String campaignId, List<R> results, ResultStore<R> store, long eligibleTotal, Duration elapsed) {
        if (results.isEmpty()) {
            return 0;
        }
        List<String> names = results.stream().map(store::domainOf).toList();
        Set<String> seen = new HashSet<>(store.existingNames(campaignId, names));
        List<R> fresh = new ArrayList<>(results.size());
        for (R r : results) {
            if (seen.add(store.domainOf(r))) {
                fresh.add(r);
            }
        }
        if (fresh.size() < results.size()) {
            log.info("Campaign {}: skipped {} already-recorded results", campaignId, results.size() - fresh.size());
        }
        if (fresh.isEmpty()) {
            return 0;
        }
        store.saveAll(fresh);

        long successful = fresh.stream().filter(store::isSuccessful).count();
        long failed = fresh.size() - successful;
        progressAggregator.apply(campaignId, new ProgressDelta(eligibleTotal, fresh.size(), successful, failed, elapsed));
        return fresh.size();
    }
}
