package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.validation.CandidateSource;
import com.github.dimitryivaniuta.domainflow.service.validation.StageAdmission;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Gives every QUEUED campaign without an active job a job: generation campaigns at once, validation
 * campaigns once their predecessor has produced an eligible row.
 *
 * <p>A predecessor that finished without any eligible rows also releases the campaign, whose first
 * job then completes it empty. The sweep also recovers campaigns whose enqueue was lost, such as a
 * resume that committed the status change but not the job.</p>
 */
@Component
public class StageLinkageSweeper {

    private static final Logger log = LoggerFactory.getLogger(StageLinkageSweeper.class);

    private final CampaignRepository campaignRepository;
    private final JobScheduler jobScheduler;
    private final StageAdmission admission;
    private final CandidateSource candidateSource;
    private final CampaignStateService campaignStateService;

    public StageLinkageSweeper(CampaignRepository campaignRepository,
                               JobScheduler jobScheduler,
                               StageAdmission admission,
                               CandidateSource candidateSource,
                               CampaignStateService campaignStateService) {
        this.campaignRepository = campaignRepository;
        this.jobScheduler = jobScheduler;
        this.admission = admission;
        this.candidateSource = candidateSource;
        this.campaignStateService = campaignStateService;
    }

    /**
     * Runs one sweep.
     *
     * @return number of jobs enqueued
     */
    @Scheduled(fixedDelayString = "${app.scheduler.linkage-sweep-interval-ms:5000}")
    public int sweep() {
        List<Campaign> waiting = campaignRepository.findByStatus(CampaignStatus.QUEUED);
        int enqueued = 0;
        for (Campaign c : waiting) {
            try {
                if (!jobScheduler.hasActiveJob(c.getId()) && tryEnqueue(c)) {
                    enqueued++;
                }
            } catch (DataIntegrityViolationException e) {
                // another instance enqueued between the check and the insert
                log.debug("Campaign {} got its job concurrently", c.getId());
            }
        }
        if (enqueued > 0) {
            log.info("Enqueued jobs for {} queued campaigns", enqueued);
        }
        return enqueued;
    }

    /**
     * Enqueues a job for {@code campaign} if its predecessor is ready. Generation campaigns have no
     * predecessor and are always enqueued.
     *
     * @param campaign queued campaign
     * @return true when a job was enqueued
     */
    public boolean tryEnqueue(Campaign campaign) {
        if (campaign.isValidationStage()) {
            Campaign source;
            try {
                source = admission.admit(campaign);
            } catch (InvalidConfigException e) {
                campaignStateService.fail(campaign.getId(), e.getMessage());
                return false;
            }
            if (candidateSource.eligibleCount(source) == 0 && !source.getStatus().isTerminal()) {
                log.debug("Campaign {} waits for source {} to produce rows", campaign.getId(), source.getId());
                return false;
            }
        }
        return jobScheduler.enqueue(campaign, Duration.ZERO).isPresent();
    }
}
