package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Claims a job, runs one batch through the matching {@link CampaignJobHandler} and hands the job
 * back to the scheduler according to the outcome.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    public static final String MDC_JOB_ID = "jobId";
    public static final String MDC_CAMPAIGN_ID = "campaignId";
    public static final String MDC_WORKER_ID = "workerId";

    private final JobScheduler scheduler;
    private final CampaignStateService campaignStateService;
    private final Map<JobType, CampaignJobHandler> handlers = new EnumMap<>(JobType.class);
    private final Duration predecessorPollDelay;

    public JobExecutor(JobScheduler scheduler,
                       CampaignStateService campaignStateService,
                       List<CampaignJobHandler> handlers,
                       AppProperties properties) {
        this.scheduler = scheduler;
        this.campaignStateService = campaignStateService;
        for (CampaignJobHandler h : handlers) {
            CampaignJobHandler previous = this.handlers.put(h.jobType(), h);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + h.jobType() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }
        this.predecessorPollDelay = properties.getScheduler().getPredecessorPollDelay();
    }

    /**
     * Claims and runs at most one job.
     *
     * @param workerId lock holder id
     * @return true when a job was claimed
     */
    public boolean runOnce(String workerId) {
        Optional<CampaignJob> claimed = scheduler.claimNext(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        execute(claimed.get(), workerId);
        return true;
    }

    void execute(CampaignJob job, String workerId) {
        MDC.put(MDC_JOB_ID, job.getId());
        MDC.put(MDC_CAMPAIGN_ID, job.getCampaignId());
        MDC.put(MDC_WORKER_ID, workerId);
        try {
            scheduler.markRunning(job.getId(), workerId);
            if (!campaignStateService.beginExecution(job.getCampaignId())) {
                log.info("Campaign {} is not runnable, closing job {}", job.getCampaignId(), job.getId());
                scheduler.complete(job, workerId);
                return;
            }
            CampaignJobHandler handler = handlers.get(job.getJobType());
            if (handler == null) {
                throw new IllegalStateException("No handler for job type " + job.getJobType());
            }
            JobOutcome outcome = handler.execute(job, new JobLease(job.getId(), workerId, scheduler));
            log.debug("Job {} finished batch with outcome {}", job.getId(), outcome);
            switch (outcome) {
                case COMPLETED, ABANDONED -> scheduler.complete(job, workerId);
                case CONTINUE -> scheduler.requeue(job, workerId, Duration.ZERO);
                case WAIT -> scheduler.requeue(job, workerId, predecessorPollDelay);
                case FAILED -> scheduler.failPermanently(job, workerId, "Campaign " + job.getCampaignId() + " failed");
            }
        } catch (LeaseExpiredException e) {
            log.warn("{}; discarding this worker's result", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} crashed", job.getId(), e);
            recordCrash(job, workerId, e);
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_CAMPAIGN_ID);
            MDC.remove(MDC_WORKER_ID);
        }
    }

    private void recordCrash(CampaignJob job, String workerId, RuntimeException cause) {
        try {
            scheduler.fail(job, workerId, cause);
        } catch (LeaseExpiredException e) {
            log.warn("{}; crash of job {} left to the lease reaper", e.getMessage(), job.getId());
        }
    }
}
