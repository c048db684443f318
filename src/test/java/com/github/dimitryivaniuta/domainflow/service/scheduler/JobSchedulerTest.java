package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.JobStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.repo.CampaignJobRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Claiming, lease guarding and lease reclamation on a real database.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JobSchedulerTest {

    @Autowired
    CampaignJobRepository jobRepository;

    @Autowired
    PlatformTransactionManager transactionManager;

    private final CampaignStateService stateService = Mockito.mock(CampaignStateService.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private JobScheduler scheduler;
    private LeaseReaper reaper;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        AppProperties properties = new AppProperties();
        properties.getScheduler().setBaseBackoff(Duration.ZERO);
        properties.getScheduler().setMaxBackoff(Duration.ZERO);
        scheduler = new JobScheduler(jobRepository, stateService, properties, transactionManager, registry);
        reaper = new LeaseReaper(jobRepository, stateService, scheduler, transactionManager, registry);
    }

    private CampaignJob saveJob(int priority, int maxAttempts, int timeoutSeconds, Instant runAt) {
        return jobRepository.save(CampaignJob.pending("c-" + priority + "-" + runAt.toEpochMilli(),
                JobType.DNS_VALIDATION, priority, maxAttempts, timeoutSeconds, runAt));
    }

    @Test
    void claim_prefersPriorityThenSchedule() {
        Instant now = Instant.now();
        CampaignJob low = saveJob(1, 3, 600, now.minusSeconds(30));
        CampaignJob highLater = saveJob(9, 3, 600, now.minusSeconds(5));
        CampaignJob highEarlier = saveJob(9, 3, 600, now.minusSeconds(10));
        saveJob(10, 3, 600, now.plusSeconds(3600));

        Assertions.assertEquals(highEarlier.getId(), scheduler.claimNext("w1").orElseThrow().getId());
        Assertions.assertEquals(highLater.getId(), scheduler.claimNext("w1").orElseThrow().getId());
        Assertions.assertEquals(low.getId(), scheduler.claimNext("w1").orElseThrow().getId());
        Assertions.assertTrue(scheduler.claimNext("w1").isEmpty());
    }

    @Test
    void concurrentWorkers_claimEachJobExactlyOnce() throws Exception {
        int jobs = 20;
        int workers = 6;
        for (int i = 0; i < jobs; i++) {
            jobRepository.save(CampaignJob.pending("campaign-" + i, JobType.DOMAIN_GENERATION, 5, 3, 600,
                    Instant.now().minusSeconds(1)));
        }

        Map<String, String> owners = new ConcurrentHashMap<>();
        Set<String> duplicates = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                String workerId = "worker-" + w;
                futures.add(pool.submit(() -> {
                    start.await();
                    while (owners.size() < jobs && System.nanoTime() < deadline) {
                        Optional<CampaignJob> claimed = scheduler.claimNext(workerId);
                        claimed.ifPresent(j -> {
                            if (owners.putIfAbsent(j.getId(), workerId) != null) {
                                duplicates.add(j.getId());
                            }
                            Assertions.assertEquals(workerId, j.getLockedBy());
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Assertions.assertTrue(duplicates.isEmpty(), "claimed twice: " + duplicates);
        Assertions.assertEquals(jobs, owners.size());
        for (CampaignJob j : jobRepository.findAll()) {
            Assertions.assertEquals(JobStatus.LOCKED, j.getStatus());
            Assertions.assertEquals(owners.get(j.getId()), j.getLockedBy());
        }
    }

    @Test
    void releasedLease_cannotBeUsedByItsFormerHolder() {
        saveJob(5, 3, 600, Instant.now().minusSeconds(1));
        CampaignJob job = scheduler.claimNext("w1").orElseThrow();
        scheduler.markRunning(job.getId(), "w1");

        Assertions.assertThrows(LeaseExpiredException.class, () -> scheduler.renewLease(job.getId(), "w2"));

        scheduler.requeue(job, "w1", Duration.ZERO);
        Assertions.assertThrows(LeaseExpiredException.class, () -> scheduler.renewLease(job.getId(), "w1"));
        Assertions.assertThrows(LeaseExpiredException.class, () -> scheduler.complete(job, "w1"));

        CampaignJob stored = jobRepository.findById(job.getId()).orElseThrow();
        Assertions.assertEquals(JobStatus.PENDING, stored.getStatus());
        Assertions.assertEquals(0, stored.getAttempts());
        Assertions.assertNull(stored.getLockedBy());
    }

    @Test
    void crashedJob_retriesWithBackoffAndThenFailsCampaign() {
        saveJob(5, 2, 600, Instant.now().minusSeconds(1));
        CampaignJob job = scheduler.claimNext("w1").orElseThrow();
        scheduler.markRunning(job.getId(), "w1");

        scheduler.fail(job, "w1", new IllegalStateException("boom"));

        CampaignJob retry = jobRepository.findById(job.getId()).orElseThrow();
        Assertions.assertEquals(JobStatus.RETRY_PENDING, retry.getStatus());
        Assertions.assertEquals(1, retry.getAttempts());
        Assertions.assertEquals("boom", retry.getLastError());

        reaper.sweep();
        CampaignJob again = scheduler.claimNext("w2").orElseThrow();
        Assertions.assertEquals(job.getId(), again.getId());
        scheduler.markRunning(again.getId(), "w2");
        scheduler.fail(again, "w2", new IllegalStateException("boom again"));

        Assertions.assertEquals(JobStatus.FAILED, jobRepository.findById(job.getId()).orElseThrow().getStatus());
        Mockito.verify(stateService).fail(job.getCampaignId(), "boom again");
    }

    @Test
    void expiredLease_isReclaimedWithExactlyOneMoreAttempt() throws InterruptedException {
        saveJob(5, 3, 0, Instant.now().minusSeconds(1));
        CampaignJob job = scheduler.claimNext("dead-worker").orElseThrow();
        scheduler.markRunning(job.getId(), "dead-worker");
        Thread.sleep(20);

        Assertions.assertEquals(1, reaper.sweep());
        Assertions.assertEquals(0, reaper.sweep());

        CampaignJob stored = jobRepository.findById(job.getId()).orElseThrow();
        Assertions.assertEquals(JobStatus.PENDING, stored.getStatus());
        Assertions.assertEquals(1, stored.getAttempts());
        Assertions.assertNull(stored.getLockedBy());
        Assertions.assertNotNull(stored.getLastError());
        Assertions.assertThrows(LeaseExpiredException.class, () -> scheduler.renewLease(job.getId(), "dead-worker"));
        Mockito.verifyNoInteractions(stateService);

        Assertions.assertEquals(job.getId(), scheduler.claimNext("w2").orElseThrow().getId());
    }

    @Test
    void expiredLease_onFinalAttempt_failsCampaign() throws InterruptedException {
        saveJob(5, 1, 0, Instant.now().minusSeconds(1));
        CampaignJob job = scheduler.claimNext("dead-worker").orElseThrow();
        Thread.sleep(20);

        Assertions.assertEquals(1, reaper.sweep());

        CampaignJob stored = jobRepository.findById(job.getId()).orElseThrow();
        Assertions.assertEquals(JobStatus.FAILED, stored.getStatus());
        Assertions.assertEquals(1, stored.getAttempts());
        Mockito.verify(stateService).fail(Mockito.eq(job.getCampaignId()), Mockito.anyString());
    }

    @Test
    void enqueue_skipsCampaignWithActiveJob() {
        Campaign campaign = Campaign.newPending("gen", CampaignType.DOMAIN_GENERATION, null, null);

        Assertions.assertTrue(scheduler.enqueue(campaign, Duration.ZERO).isPresent());
        Assertions.assertTrue(scheduler.enqueue(campaign, Duration.ZERO).isEmpty());
        Assertions.assertEquals(1, scheduler.jobsOf(campaign.getId()).size());
    }
}
