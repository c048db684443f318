package com.github.dimitryivaniuta.domainflow.service.campaign;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.error.CampaignNotFoundException;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.IllegalCampaignTransitionException;
import com.github.dimitryivaniuta.domainflow.service.notify.CampaignEventMessage;
import com.github.dimitryivaniuta.domainflow.service.notify.CampaignNotifier;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressSnapshotCache;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies campaign status transitions under the campaign row lock and emits a
 * {@code campaign.status} notification for each one.
 */
@Service
public class CampaignStateService {

    private static final Logger log = LoggerFactory.getLogger(CampaignStateService.class);

    private final CampaignRepository campaignRepository;
    private final ProgressAggregator progressAggregator;
    private final CampaignNotifier notifier;
    private final ProgressSnapshotCache snapshotCache;

    public CampaignStateService(CampaignRepository campaignRepository,
                                ProgressAggregator progressAggregator,
                                CampaignNotifier notifier,
                                ProgressSnapshotCache snapshotCache) {
        this.campaignRepository = campaignRepository;
        this.progressAggregator = progressAggregator;
        this.notifier = notifier;
        this.snapshotCache = snapshotCache;
    }

    /**
     * Moves the campaign to {@code target}.
     *
     * @param campaignId campaign id
     * @param target     new status
     * @return updated campaign
     * @throws IllegalCampaignTransitionException when not allowed from the current status
     */
    @Transactional
    public Campaign transition(String campaignId, CampaignStatus target) {
        Campaign c = lock(campaignId);
        if (!c.getStatus().canTransitionTo(target)) {
            throw new IllegalCampaignTransitionException(campaignId, c.getStatus(), target);
        }
        apply(c, target);
        return c;
    }

    /**
     * Called by a worker before running a job: QUEUED becomes RUNNING.
     *
     * @param campaignId campaign id
     * @return true when the campaign is RUNNING and work may proceed
     */
    @Transactional
    public boolean beginExecution(String campaignId) {
        Campaign c = lock(campaignId);
        if (c.getStatus() == CampaignStatus.QUEUED) {
            apply(c, CampaignStatus.RUNNING);
        }
        return c.getStatus() == CampaignStatus.RUNNING;
    }

    /**
     * RUNNING to COMPLETED, settling counters. No-op for other statuses.
     *
     * @param campaignId campaign id
     * @return true when the campaign completed
     */
    @Transactional
    public boolean complete(String campaignId) {
        Campaign c = lock(campaignId);
        if (c.getStatus() != CampaignStatus.RUNNING) {
            log.debug("Not completing campaign {} in status {}", campaignId, c.getStatus());
            return false;
        }
        progressAggregator.settle(c);
        apply(c, CampaignStatus.COMPLETED);
        log.info("Campaign {} completed: processed={} successful={} failed={}",
                campaignId, c.getProcessedItems(), c.getSuccessfulItems(), c.getFailedItems());
        return true;
    }

    /**
     * Fails the campaign with a user-visible error, if it is still active.
     *
     * @param campaignId campaign id
     * @param error      error message
     */
    @Transactional
    public void fail(String campaignId, String error) {
        Campaign c = lock(campaignId);
        if (!c.getStatus().canTransitionTo(CampaignStatus.FAILED)) {
            log.warn("Campaign {} in status {} not failed; error was: {}", campaignId, c.getStatus(), error);
            return;
        }
        c.setErrorMessage(ErrorMessages.truncate(error));
        apply(c, CampaignStatus.FAILED);
        log.error("Campaign {} failed: {}", campaignId, error);
    }

    /**
     * Pauses a campaign whose resource pool is empty and flags it as degraded.
     *
     * @param campaignId campaign id
     * @param reason     what ran out
     */
    @Transactional
    public void degrade(String campaignId, String reason) {
        Campaign c = lock(campaignId);
        if (!c.getStatus().canTransitionTo(CampaignStatus.PAUSED)) {
            return;
        }
        c.setDegraded(true);
        c.setErrorMessage(ErrorMessages.truncate(reason));
        apply(c, CampaignStatus.PAUSED);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        data.put("status", c.getStatus());
        notifier.publish(new CampaignEventMessage(campaignId, CampaignEventMessage.DEGRADED, data, Instant.now()));
        log.warn("Campaign {} paused as degraded: {}", campaignId, reason);
    }

    private Campaign lock(String campaignId) {
        return campaignRepository.findByIdForUpdate(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    private void apply(Campaign c, CampaignStatus target) {
        CampaignStatus previous = c.getStatus();
        c.transitionTo(target);
        boolean reactivated = target == CampaignStatus.QUEUED || target == CampaignStatus.RUNNING;
        if (reactivated && (c.isDegraded() || previous == CampaignStatus.FAILED)) {
            c.setDegraded(false);
            c.setErrorMessage(null);
        }
        campaignRepository.save(c);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", target);
        data.put("previousStatus", previous);
        data.put("errorMessage", c.getErrorMessage());
        notifier.publish(new CampaignEventMessage(c.getId(), CampaignEventMessage.STATUS, data, Instant.now()));
        snapshotCache.evict(c.getId());
    }
}
