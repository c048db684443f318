package com.github.dimitryivaniuta.domainflow.service.scheduler;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.LeaseExpiredException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

/**
 * How a handler's outcome is handed back to the scheduler.
 */
class JobExecutorTest {

    private final JobScheduler scheduler = Mockito.mock(JobScheduler.class);
    private final CampaignStateService stateService = Mockito.mock(CampaignStateService.class);
    private final CampaignJobHandler handler = Mockito.mock(CampaignJobHandler.class);

    private JobExecutor executor;
    private CampaignJob job;

    @BeforeEach
    void setUp() {
        Mockito.when(handler.jobType()).thenReturn(JobType.DNS_VALIDATION);
        AppProperties properties = new AppProperties();
        properties.getScheduler().setPredecessorPollDelay(Duration.ofSeconds(7));
        executor = new JobExecutor(scheduler, stateService, List.of(handler), properties);

        job = CampaignJob.pending("c-1", JobType.DNS_VALIDATION, 5, 3, 600, Instant.now());
        Mockito.when(stateService.beginExecution("c-1")).thenReturn(true);
    }

    private void outcome(JobOutcome outcome) {
        Mockito.when(handler.execute(Mockito.eq(job), Mockito.any())).thenReturn(outcome);
        executor.execute(job, "w-1");
    }

    @Test
    void completed_completesTheJob() {
        outcome(JobOutcome.COMPLETED);

        Mockito.verify(scheduler).markRunning(job.getId(), "w-1");
        Mockito.verify(scheduler).complete(job, "w-1");
    }

    @Test
    void abandoned_completesTheJob() {
        outcome(JobOutcome.ABANDONED);

        Mockito.verify(scheduler).complete(job, "w-1");
        Mockito.verify(scheduler, Mockito.never()).requeue(Mockito.any(), Mockito.any(), Mockito.any());
    }

    @Test
    void continueOutcome_requeuesAtOnce() {
        outcome(JobOutcome.CONTINUE);

        Mockito.verify(scheduler).requeue(job, "w-1", Duration.ZERO);
    }

    @Test
    void waitOutcome_requeuesAfterThePollDelay() {
        outcome(JobOutcome.WAIT);

        Mockito.verify(scheduler).requeue(job, "w-1", Duration.ofSeconds(7));
    }

    @Test
    void failed_failsTheJobWithoutRetry() {
        outcome(JobOutcome.FAILED);

        Mockito.verify(scheduler).failPermanently(Mockito.eq(job), Mockito.eq("w-1"), Mockito.contains("c-1"));
        Mockito.verify(scheduler, Mockito.never()).fail(Mockito.any(), Mockito.any(), Mockito.any());
    }

    @Test
    void crashingHandler_consumesAnAttempt() {
        IllegalStateException boom = new IllegalStateException("boom");
        Mockito.when(handler.execute(Mockito.eq(job), Mockito.any())).thenThrow(boom);

        executor.execute(job, "w-1");

        Mockito.verify(scheduler).fail(job, "w-1", boom);
    }

    @Test
    void lostLease_leavesTheJobToItsNewOwner() {
        Mockito.when(handler.execute(Mockito.eq(job), Mockito.any())).thenThrow(new LeaseExpiredException(job.getId(), "w-1"));

        executor.execute(job, "w-1");

        Mockito.verify(scheduler, Mockito.never()).fail(Mockito.any(), Mockito.any(), Mockito.any());
        Mockito.verify(scheduler, Mockito.never()).complete(Mockito.any(), Mockito.any());
    }

    @Test
    void campaignNoLongerRunnable_closesTheJobWithoutRunningIt() {
        Mockito.when(stateService.beginExecution("c-1")).thenReturn(false);

        executor.execute(job, "w-1");

        Mockito.verify(scheduler).complete(job, "w-1");
        Mockito.verify(handler, Mockito.never()).execute(Mockito.any(), Mockito.any());
    }

    @Test
    void twoHandlersForOneJobType_areRejected() {
        CampaignJobHandler other = Mockito.mock(CampaignJobHandler.class);
        Mockito.when(other.jobType()).thenReturn(JobType.DNS_VALIDATION);

        Assertions.assertThrows(IllegalStateException.class,
                () -> new JobExecutor(scheduler, stateService, List.of(handler, other), new AppProperties()));
    }
}
