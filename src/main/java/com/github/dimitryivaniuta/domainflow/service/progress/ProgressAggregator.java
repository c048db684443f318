package com.github.dimitryivaniuta.domainflow.service.progress;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.error.CampaignNotFoundException;
import com.github.dimitryivaniuta.domainflow.service.notify.CampaignEventMessage;
import com.github.dimitryivaniuta.domainflow.service.notify.CampaignNotifier;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sole writer of campaign counters.
 *
 * <p>Runs inside the transaction that writes the batch's rows and holds the campaign row lock while
 * it adds the deltas, so concurrent batches serialise and every committed state satisfies
 * {@code processed <= total} and {@code successful + failed <= processed}.</p>
 */
@Service
public class ProgressAggregator {

    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    private final CampaignRepository campaignRepository;
    private final CampaignNotifier notifier;
    private final ProgressSnapshotCache snapshotCache;
    private final AppProperties properties;

    public ProgressAggregator(CampaignRepository campaignRepository,
                              CampaignNotifier notifier,
                              ProgressSnapshotCache snapshotCache,
                              AppProperties properties) {
        this.campaignRepository = campaignRepository;
        this.notifier = notifier;
        this.snapshotCache = snapshotCache;
        this.properties = properties;
    }

    /**
     * Adds one batch's counts to the campaign.
     *
     * @param campaignId campaign id
     * @param delta      batch counts
     * @return snapshot after the update
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ProgressSnapshot apply(String campaignId, ProgressDelta delta) {
        Campaign c = campaignRepository.findByIdForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        Instant now = Instant.now();

        long processed = c.getProcessedItems() + delta.processed();
        long total = Math.max(c.getTotalItems(), delta.totalItems());
        if (processed > total) {
            log.debug("Campaign {} processed {} ahead of total {}, raising total", campaignId, processed, total);
            total = processed;
        }
        c.setTotalItems(total);
        c.setProcessedItems(processed);
        c.setSuccessfulItems(c.getSuccessfulItems() + delta.successful());
        c.setFailedItems(c.getFailedItems() + delta.failed());

        Double sample = ProgressMath.rate(delta.processed(), delta.elapsed());
        if (sample != null) {
            c.setAvgProcessingRate(ProgressMath.ewma(c.getAvgProcessingRate(), sample,
                    properties.getGeneration().getRateSmoothing()));
        }
        refreshDerived(c, now);

        ProgressSnapshot snapshot = ProgressSnapshot.from(c);
        notifier.publish(new CampaignEventMessage(campaignId, CampaignEventMessage.PROGRESS, snapshot, now));
        snapshotCache.evict(campaignId);
        return snapshot;
    }

    /**
     * Closes out the counters of a campaign that is completing: the total shrinks to what was
     * actually processed (e.g. after enumerator exhaustion).
     *
     * @param campaign campaign locked by the caller
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void settle(Campaign campaign) {
        campaign.setTotalItems(campaign.getProcessedItems());
        refreshDerived(campaign, Instant.now());
        if (campaign.getTotalItems() == 0) {
            campaign.setProgressPercentage(100.0d);
        }
        snapshotCache.evict(campaign.getId());
    }

    /**
     * Heartbeat without counter changes, e.g. while a validation stage waits for its predecessor.
     *
     * @param campaignId campaign id
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void heartbeat(String campaignId) {
        campaignRepository.findByIdForUpdate(campaignId).ifPresent(c -> {
            Instant now = Instant.now();
            c.setLastHeartbeatAt(now);
            c.setUpdatedAt(now);
        });
    }

    private static void refreshDerived(Campaign c, Instant now) {
        c.setProgressPercentage(ProgressMath.percentage(c.getProcessedItems(), c.getTotalItems()));
        c.setEstimatedCompletionAt(ProgressMath.eta(now, c.getTotalItems() - c.getProcessedItems(), c.getAvgProcessingRate()));
        c.setLastHeartbeatAt(now);
        c.setUpdatedAt(now);
    }
}
