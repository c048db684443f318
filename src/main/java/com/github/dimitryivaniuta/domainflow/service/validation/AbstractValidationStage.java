package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.ValidationParams;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.CampaignNotFoundException;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.error.ResourcePoolExhaustedException;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.scheduler.CampaignJobHandler;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobLease;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobOutcome;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One batch of a validation stage: admission, candidate selection, parallel checks with retries on
 * rotating resources, and a single transactional write of results and progress.
 *
 * <p>A campaign with a {@code processingSpeedPerMinute} draws one permit per domain; a batch that
 * runs out of permits writes what it checked and asks to be requeued later.</p>
 *
 * <p>Per-domain failures never abort the batch: a domain whose attempts all fail gets a result row
 * with a failure status. Only an emptied resource pool stops the batch, which pauses the campaign
 * as degraded.</p>
 *
 * @param <P> stage parameters
 * @param <R> result entity
 */
public abstract class AbstractValidationStage<P extends ValidationParams, R> implements CampaignJobHandler {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final CampaignRepository campaignRepository;
    private final StageAdmission admission;
    private final CandidateSource candidateSource;
    private final CampaignStateService campaignStateService;
    private final ProgressAggregator progressAggregator;
    private final ValidationResultWriter resultWriter;
    private final TransactionTemplate tx;
    private final AsyncTaskExecutor executor;
    private final CampaignRateLimiters rateLimiters;
    private final Counter checkedCounter;
    private final Counter failedAttemptCounter;

    protected AbstractValidationStage(StageSupport support, String metricPrefix) {
        this.campaignRepository = support.campaignRepository();
        this.admission = support.admission();
        this.candidateSource = support.candidateSource();
        this.campaignStateService = support.campaignStateService();
        this.progressAggregator = support.progressAggregator();
        this.resultWriter = support.resultWriter();
        this.tx = new TransactionTemplate(support.transactionManager());
        this.executor = support.validationExecutor();
        this.rateLimiters = support.rateLimiters();
        MeterRegistry registry = support.meterRegistry();
        this.checkedCounter = Counter.builder(metricPrefix + ".checked").register(registry);
        this.failedAttemptCounter = Counter.builder(metricPrefix + ".attempt.failed").register(registry);
    }

    protected abstract Optional<P> loadParams(String campaignId);

    /**
     * Prepares a batch: builds resource pools and anything else shared by the batch's checks.
     *
     * @throws ResourcePoolExhaustedException when no resource is usable
     */
    protected abstract BatchRunner<R> openBatch(Campaign campaign, P params);

    protected abstract ResultStore<R> resultStore();

    /**
     * Records attempts and total duration on a result.
     */
    protected abstract void stamp(R result, int attempts, long durationMs);

    @Override
    public JobOutcome execute(CampaignJob job, JobLease lease) {
        String campaignId = job.getCampaignId();
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        P params = loadParams(campaignId).orElse(null);
        if (params == null) {
            campaignStateService.fail(campaignId, "Missing " + campaign.getType().getSourceTypeName() + " parameters");
            return JobOutcome.FAILED;
        }

        Campaign source;
        try {
            source = admission.admit(campaign);
        } catch (InvalidConfigException e) {
            campaignStateService.fail(campaignId, e.getMessage());
            return JobOutcome.FAILED;
        }

        // read before the candidates so rows committed by a finishing source are not missed
        boolean sourceFinished = source.getStatus().isTerminal();
        List<String> candidates = candidateSource.next(campaign, source, Math.max(1, params.getBatchSize()));
        if (candidates.isEmpty()) {
            if (sourceFinished) {
                rateLimiters.release(campaignId);
                campaignStateService.complete(campaignId);
                return JobOutcome.COMPLETED;
            }
            tx.executeWithoutResult(status -> progressAggregator.heartbeat(campaignId));
            log.debug("Campaign {} waiting for source {} ({})", campaignId, source.getId(), source.getStatus());
            return JobOutcome.WAIT;
        }

        BatchRunner<R> runner;
        try {
            runner = openBatch(campaign, params);
        } catch (ResourcePoolExhaustedException e) {
            campaignStateService.degrade(campaignId, e.getMessage());
            return JobOutcome.ABANDONED;
        }

        RateLimiter limiter = rateLimiters.forCampaign(campaignId, params.getProcessingSpeedPerMinute()).orElse(null);
        long started = System.nanoTime();
        AtomicBoolean poolExhausted = new AtomicBoolean(false);
        AtomicBoolean throttled = new AtomicBoolean(false);
        List<R> results = checkAll(job, lease, candidates, params, runner, limiter, poolExhausted, throttled);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        lease.renew();
        long eligible = candidateSource.eligibleCount(source);
        int written = resultWriter.write(campaignId, results, resultStore(), eligible, elapsed);
        log.info("Campaign {}: checked {} of {} candidates in {} ms", campaignId, written, candidates.size(), elapsed.toMillis());

        if (poolExhausted.get()) {
            campaignStateService.degrade(campaignId, "All " + runner.resourceLabel() + " excluded by circuit breaker");
            return JobOutcome.ABANDONED;
        }
        if (throttled.get()) {
            log.debug("Campaign {} reached {} checks/min", campaignId, params.getProcessingSpeedPerMinute());
            return JobOutcome.WAIT;
        }
        return JobOutcome.CONTINUE;
    }

    /**
     * Runs the checks on {@code min(parallelWorkers, batch)} lanes of the shared executor. Each lane
     * pulls domains from a common queue. The calling thread renews the lease while it waits.
     */
    private List<R> checkAll(CampaignJob job, JobLease lease, List<String> domains, P params, BatchRunner<R> runner,
                             RateLimiter limiter, AtomicBoolean poolExhausted, AtomicBoolean throttled) {
        int laneCount = Math.max(1, Math.min(params.getParallelWorkers(), domains.size()));
        Queue<String> pending = new ConcurrentLinkedQueue<>(domains);
        Map<String, R> checked = new ConcurrentHashMap<>();
        AtomicBoolean stop = new AtomicBoolean(false);
        Runnable lane = () -> {
            while (!stop.get() && !poolExhausted.get()) {
                String domain = pending.poll();
                if (domain == null) {
                    return;
                }
                if (limiter != null && !limiter.acquirePermission()) {
                    throttled.set(true);
                    stop.set(true);
                    return;
                }
                R result = checkOne(domain, params.getRetryAttempts(), runner, poolExhausted);
                if (result != null) {
                    checked.put(domain, result);
                }
            }
        };

        List<Future<?>> lanes = new ArrayList<>(laneCount);
        Duration renewEvery = Duration.ofSeconds(Math.max(1, job.getTimeoutSeconds() / 3));
        try {
            for (int i = 0; i < laneCount; i++) {
                lanes.add(executor.submit(lane));
            }
            for (Future<?> f : lanes) {
                while (!finished(f, renewEvery)) {
                    lease.renew();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(lanes, stop);
            throw new IllegalStateException("Interrupted while validating batch of campaign " + job.getCampaignId(), e);
        } catch (ExecutionException e) {
            cancel(lanes, stop);
            throw new IllegalStateException("Validation lane failed for campaign " + job.getCampaignId(), e.getCause());
        } catch (RuntimeException e) {
            cancel(lanes, stop);
            throw e;
        }

        List<R> results = new ArrayList<>(checked.size());
        for (String domain : domains) {
            R r = checked.get(domain);
            if (r != null) {
                results.add(r);
            }
        }
        return results;
    }

    private static boolean finished(Future<?> lane, Duration wait) throws InterruptedException, ExecutionException {
        try {
            lane.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    private static void cancel(List<Future<?>> lanes, AtomicBoolean stop) {
        stop.set(true);
        lanes.forEach(f -> f.cancel(true));
    }

    /**
     * Checks one domain with up to {@code 1 + retryAttempts} attempts, each preferring resources not
     * used by earlier attempts.
     *
     * @return result, or null when the pool ran dry before the domain got a verdict
     */
    R checkOne(String domain, int retryAttempts, BatchRunner<R> runner, AtomicBoolean poolExhausted) {
        long started = System.nanoTime();
        Set<String> tried = new HashSet<>();
        TransportException last = null;
        int attempts = 0;
        R result = null;
        try {
            while (attempts <= retryAttempts && result == null) {
                attempts++;
                try {
                    result = runner.attempt(domain, tried);
                } catch (TransportException e) {
                    last = e;
                    failedAttemptCounter.increment();
                    log.debug("Attempt {} for {} failed: {}", attempts, domain, e.getMessage());
                }
            }
        } catch (ResourcePoolExhaustedException e) {
            poolExhausted.set(true);
            log.warn("Stopping batch at {}: {}", domain, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Check of {} failed unexpectedly", domain, e);
            last = new TransportException(ErrorMessages.safe(e), false, e);
        }
        if (result == null) {
            result = runner.failed(domain, last);
        }
        stamp(result, attempts, (System.nanoTime() - started) / 1_000_000L);
        checkedCounter.increment();
        return result;
    }

    /**
     * Per-batch check logic of a stage. Shared by the batch's worker threads.
     *
     * @param <R> result entity
     */
    protected interface BatchRunner<R> {

        /**
         * One attempt. Implementations acquire their resources from the batch's pools, add the ids to
         * {@code tried} and record the outcome on the pools.
         *
         * @throws TransportException             when the network check failed
         * @throws ResourcePoolExhaustedException when no resource is usable
         */
        R attempt(String domain, Set<String> tried);

        /**
         * Result for a domain whose attempts all failed.
         *
         * @param last last transport error, null when no attempt could run
         */
        R failed(String domain, TransportException last);

        String resourceLabel();
    }
}
