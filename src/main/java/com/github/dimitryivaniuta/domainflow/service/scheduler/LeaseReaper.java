package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobStatus;
import com.github.dimitryivaniuta.domainflow.repo.CampaignJobRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Periodic crash recovery for the job queue.
 *
 * <p>A LOCKED or RUNNING job whose lease is older than its {@code timeoutSeconds} belongs to a dead
 * or stuck worker. It goes back to PENDING with one more attempt and a backoff delay, or to FAILED
 * (failing its campaign) once attempts are used up. The same sweep promotes due RETRY_PENDING jobs.</p>
 */
@Component
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final CampaignJobRepository jobRepository;
    private final CampaignStateService campaignStateService;
    private final JobScheduler jobScheduler;
    private final TransactionTemplate requiresNew;
    private final Counter reclaimedCounter;

    public LeaseReaper(CampaignJobRepository jobRepository,
                       CampaignStateService campaignStateService,
                       JobScheduler jobScheduler,
                       PlatformTransactionManager transactionManager,
                       MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.campaignStateService = campaignStateService;
        this.jobScheduler = jobScheduler;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.reclaimedCounter = Counter.builder("domainflow.jobs.lease.reclaimed").register(meterRegistry);
    }

    /**
     * Runs one sweep.
     *
     * @return number of leases reclaimed
     */
    @Scheduled(fixedDelayString = "${app.scheduler.lease-sweep-interval-ms:15000}")
    public int sweep() {
        Instant now = Instant.now();
        Integer promoted = requiresNew.execute(status -> jobRepository.promoteDueRetries(now));
        if (promoted != null && promoted > 0) {
            log.debug("Promoted {} retry-pending jobs", promoted);
        }

        List<CampaignJob> leased = requiresNew.execute(status ->
                jobRepository.findByStatusIn(EnumSet.of(JobStatus.LOCKED, JobStatus.RUNNING)));
        int reclaimed = 0;
        for (CampaignJob job : leased == null ? List.<CampaignJob>of() : leased) {
            if (job.isLeaseExpired(now) && reclaim(job, now)) {
                reclaimed++;
            }
        }
        return reclaimed;
    }

    private boolean reclaim(CampaignJob job, Instant now) {
        int attempts = job.getAttempts() + 1;
        String error = new LeaseExpiredException(job.getId(), job.getLockedBy()).getMessage()
                + (job.getLastError() == null ? "" : "; last error: " + job.getLastError());
        boolean exhausted = attempts >= job.getMaxAttempts();

        Integer updated = requiresNew.execute(status -> {
            int n;
            if (exhausted) {
                n = jobRepository.reclaim(job.getId(), job.getLockedBy(), job.getLockedAt(),
                        JobStatus.FAILED, job.getNextExecutionAt(), error, now);
                if (n == 1) {
                    campaignStateService.fail(job.getCampaignId(), error);
                }
            } else {
                n = jobRepository.reclaim(job.getId(), job.getLockedBy(), job.getLockedAt(),
                        JobStatus.PENDING, jobScheduler.backoff().nextExecution(now, attempts), error, now);
            }
            return n;
        });
        if (updated == null || updated != 1) {
            return false;
        }
        reclaimedCounter.increment();
        if (exhausted) {
            log.error("Job {} of campaign {} failed: lease expired on final attempt {}", job.getId(), job.getCampaignId(), attempts);
        } else {
            log.warn("Reclaimed expired lease on job {} held by {} (attempt {}/{})",
                    job.getId(), job.getLockedBy(), attempts, job.getMaxAttempts());
        }
        return true;
    }
}
