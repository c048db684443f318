package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.repo.CampaignJobRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Lease-based job queue shared by every worker thread and process.
 *
 * <p>Claiming is a two-step read-then-conditional-update: candidates are read in dispatch order, then
 * each is locked with an update that only succeeds while the job is still PENDING and unlocked. Each
 * step commits on its own so a lost race costs one row and the worker moves on to the next
 * candidate. Every later transition is guarded by {@code lockedBy}, so a worker whose lease was
 * reclaimed cannot overwrite the new holder's state.</p>
 */
@Service
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    static final int CLAIM_CANDIDATES = 10;

    static final EnumSet<JobStatus> ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.LOCKED, JobStatus.RUNNING, JobStatus.RETRY_PENDING);

    private final CampaignJobRepository jobRepository;
    private final CampaignStateService campaignStateService;
    private final AppProperties properties;
    private final BackoffPolicy backoff;
    private final TransactionTemplate requiresNew;

    private final Counter claimedCounter;
    private final Counter lostRaceCounter;
    private final Counter failedCounter;

    public JobScheduler(CampaignJobRepository jobRepository,
                        CampaignStateService campaignStateService,
                        AppProperties properties,
                        PlatformTransactionManager transactionManager,
                        MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.campaignStateService = campaignStateService;
        this.properties = properties;
        this.backoff = new BackoffPolicy(properties.getScheduler().getBaseBackoff(), properties.getScheduler().getMaxBackoff());
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.claimedCounter = Counter.builder("domainflow.jobs.claimed").register(meterRegistry);
        this.lostRaceCounter = Counter.builder("domainflow.jobs.claim.lost").register(meterRegistry);
        this.failedCounter = Counter.builder("domainflow.jobs.failed").register(meterRegistry);
    }

    public BackoffPolicy backoff() {
        return backoff;
    }

    /**
     * Queues a job for {@code campaign} unless it already has an active one.
     *
     * @param campaign campaign entering QUEUED
     * @param delay    delay before the job becomes claimable
     * @return the new job, or empty when one is already active
     */
    @Transactional
    public Optional<CampaignJob> enqueue(Campaign campaign, Duration delay) {
        if (jobRepository.existsByCampaignIdAndStatusIn(campaign.getId(), ACTIVE)) {
            return Optional.empty();
        }
        AppProperties.Scheduler s = properties.getScheduler();
        CampaignJob job = CampaignJob.pending(
                campaign.getId(),
                JobType.forCampaign(campaign.getType()),
                s.getDefaultPriority(),
                s.getDefaultMaxAttempts(),
                s.getDefaultTimeoutSeconds(),
                Instant.now().plus(delay)
        );
        jobRepository.save(job);
        log.info("Enqueued {} job {} for campaign {}", job.getJobType(), job.getId(), campaign.getId());
        return Optional.of(job);
    }

    /**
     * Claims the best due job for {@code workerId}.
     *
     * @param workerId lock holder id
     * @return the locked job, or empty when nothing is claimable
     */
    public Optional<CampaignJob> claimNext(String workerId) {
        Instant now = Instant.now();
        List<CampaignJob> candidates = requiresNew.execute(status ->
                jobRepository.findClaimCandidates(now, PageRequest.of(0, CLAIM_CANDIDATES)));
        if (candidates == null) {
            return Optional.empty();
        }
        for (CampaignJob candidate : candidates) {
            Integer updated;
            try {
                updated = requiresNew.execute(status -> jobRepository.tryLock(candidate.getId(), workerId, Instant.now()));
            } catch (DataAccessException | TransactionException e) {
                log.debug("Lock attempt on job {} by {} conflicted: {}", candidate.getId(), workerId, e.getMessage());
                updated = 0;
            }
            if (updated != null && updated == 1) {
                claimedCounter.increment();
                return requiresNew.execute(status -> jobRepository.findById(candidate.getId()));
            }
            lostRaceCounter.increment();
        }
        return Optional.empty();
    }

    /**
     * LOCKED to RUNNING.
     *
     * @throws LeaseExpiredException when the lease is gone
     */
    public void markRunning(String jobId, String workerId) {
        Integer updated = requiresNew.execute(status -> jobRepository.markRunning(jobId, workerId, Instant.now()));
        requireHeld(updated, jobId, workerId);
    }

    /**
     * Refreshes the lease timestamp.
     *
     * @throws LeaseExpiredException when the lease is gone
     */
    public void renewLease(String jobId, String workerId) {
        Integer updated = requiresNew.execute(status -> jobRepository.renewLease(jobId, workerId, Instant.now()));
        requireHeld(updated, jobId, workerId);
    }

    /**
     * Releases the job as COMPLETED.
     */
    public void complete(CampaignJob job, String workerId) {
        release(job, workerId, JobStatus.COMPLETED, 0, job.getNextExecutionAt(), null);
    }

    /**
     * Puts the job back to PENDING without consuming an attempt.
     *
     * @param delay delay before it is claimable again
     */
    public void requeue(CampaignJob job, String workerId, Duration delay) {
        release(job, workerId, JobStatus.PENDING, 0, Instant.now().plus(delay), null);
    }

    /**
     * Releases the job as FAILED without touching the campaign (the handler already failed it).
     */
    public void failPermanently(CampaignJob job, String workerId, String error) {
        failedCounter.increment();
        release(job, workerId, JobStatus.FAILED, 1, job.getNextExecutionAt(), ErrorMessages.truncate(error));
    }

    /**
     * Records a job-level crash: RETRY_PENDING with backoff, or FAILED together with the campaign once
     * attempts are exhausted.
     *
     * @param job      job as claimed
     * @param workerId lock holder
     * @param error    cause
     */
    public void fail(CampaignJob job, String workerId, Throwable error) {
        String message = ErrorMessages.safe(error);
        int attempts = job.getAttempts() + 1;
        Instant now = Instant.now();
        if (attempts >= job.getMaxAttempts()) {
            Integer updated = requiresNew.execute(status -> {
                int n = jobRepository.release(job.getId(), workerId, JobStatus.FAILED, 1, job.getNextExecutionAt(), message, now);
                if (n == 1) {
                    campaignStateService.fail(job.getCampaignId(), message);
                }
                return n;
            });
            requireHeld(updated, job.getId(), workerId);
            failedCounter.increment();
            log.error("Job {} failed permanently after {} attempts: {}", job.getId(), attempts, message);
        } else {
            Instant next = backoff.nextExecution(now, attempts);
            release(job, workerId, JobStatus.RETRY_PENDING, 1, next, message);
            log.warn("Job {} failed (attempt {}/{}), retry at {}: {}", job.getId(), attempts, job.getMaxAttempts(), next, message);
        }
    }

    private void release(CampaignJob job, String workerId, JobStatus status, int attemptDelta, Instant next, String error) {
        Integer updated = requiresNew.execute(tx ->
                jobRepository.release(job.getId(), workerId, status, attemptDelta, next, error, Instant.now()));
        requireHeld(updated, job.getId(), workerId);
    }

    private static void requireHeld(Integer updated, String jobId, String workerId) {
        if (updated == null || updated != 1) {
            throw new LeaseExpiredException(jobId, workerId);
        }
    }

    /**
     * Jobs of a campaign, oldest first.
     */
    @Transactional(readOnly = true, propagation = Propagation.SUPPORTS)
    public List<CampaignJob> jobsOf(String campaignId) {
        return jobRepository.findByCampaignIdOrderByCreatedAtAsc(campaignId);
    }

    public boolean hasActiveJob(String campaignId) {
        return jobRepository.existsByCampaignIdAndStatusIn(campaignId, ACTIVE);
    }
}
