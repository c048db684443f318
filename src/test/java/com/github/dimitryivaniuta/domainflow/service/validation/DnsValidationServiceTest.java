package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationParams;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationResult;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationStatus;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;
import com.github.dimitryivaniuta.domainflow.domain.SelectionStrategy;
import com.github.dimitryivaniuta.domainflow.domain.SystemStatus;
import com.github.dimitryivaniuta.domainflow.domain.persona.DnsPersonaConfig;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationParamsRepository;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationResultRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.TransportException;
import com.github.dimitryivaniuta.domainflow.service.pool.CircuitBreaker;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePool;
import com.github.dimitryivaniuta.domainflow.service.pool.ResourcePoolManager;
import com.github.dimitryivaniuta.domainflow.service.pool.RoundRobinSelector;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobLease;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobOutcome;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * DNS stage batch behaviour: retries on rotated personas, failure verdicts, waiting and degrading.
 */
class DnsValidationServiceTest {

    private final CampaignRepository campaignRepository = Mockito.mock(CampaignRepository.class);
    private final StageAdmission admission = Mockito.mock(StageAdmission.class);
    private final CandidateSource candidateSource = Mockito.mock(CandidateSource.class);
    private final CampaignStateService stateService = Mockito.mock(CampaignStateService.class);
    private final ProgressAggregator aggregator = Mockito.mock(ProgressAggregator.class);
    private final ValidationResultWriter writer = Mockito.mock(ValidationResultWriter.class);
    private final DnsValidationParamsRepository paramsRepository = Mockito.mock(DnsValidationParamsRepository.class);
    private final DnsValidationResultRepository resultRepository = Mockito.mock(DnsValidationResultRepository.class);
    private final ResourcePoolManager poolManager = Mockito.mock(ResourcePoolManager.class);
    private final DnsResolver resolver = Mockito.mock(DnsResolver.class);
    private final JobScheduler scheduler = Mockito.mock(JobScheduler.class);

    private final DnsPersonaConfig flakyConfig = new DnsPersonaConfig(List.of("10.0.0.1"), List.of("A"), 2);
    private final DnsPersonaConfig goodConfig = new DnsPersonaConfig(List.of("10.0.0.2"), List.of("A"), 2);
    private final Persona flaky = persona("p1", flakyConfig);
    private final Persona good = persona("p2", goodConfig);

    private DnsValidationService service;
    private Campaign source;
    private Campaign campaign;
    private CampaignJob job;
    private JobLease lease;

    private static Persona persona(String id, DnsPersonaConfig config) {
        Persona p = Persona.create(id, config);
        p.setId(id);
        return p;
    }

    @BeforeEach
    void setUp() {
        StageSupport support = new StageSupport(campaignRepository, admission, candidateSource, stateService, aggregator,
                writer, Mockito.mock(PlatformTransactionManager.class), new SimpleMeterRegistry(),
                new SimpleAsyncTaskExecutor("test-lane-"), new CampaignRateLimiters(new AppProperties()));
        service = new DnsValidationService(support, paramsRepository, resultRepository, poolManager, resolver);

        source = Campaign.newPending("gen", CampaignType.DOMAIN_GENERATION, null, null);
        source.setStatus(CampaignStatus.RUNNING);
        campaign = Campaign.newPending("dns", CampaignType.DNS_VALIDATION, source.getId(), CampaignType.DOMAIN_GENERATION);
        campaign.setStatus(CampaignStatus.RUNNING);
        job = CampaignJob.pending(campaign.getId(), JobType.DNS_VALIDATION, 5, 3, 600, Instant.now());
        lease = new JobLease(job.getId(), "w-1", scheduler);

        DnsValidationParams params = new DnsValidationParams();
        params.setCampaignId(campaign.getId());
        params.setPersonaIds(List.of("p1", "p2"));
        params.setSelectionStrategy(SelectionStrategy.ROUND_ROBIN);
        params.setBatchSize(10);
        params.setRetryAttempts(1);
        params.setParallelWorkers(1);
        params.setRequestTimeoutSeconds(5);

        Mockito.when(campaignRepository.findById(campaign.getId())).thenReturn(Optional.of(campaign));
        Mockito.when(paramsRepository.findById(campaign.getId())).thenReturn(Optional.of(params));
        Mockito.when(admission.admit(campaign)).thenReturn(source);
        Mockito.when(poolManager.personaPool(List.of("p1", "p2"), PersonaType.DNS, SelectionStrategy.ROUND_ROBIN, 0))
                .thenReturn(new ResourcePool<>("dns personas", List.of(flaky, good), new CircuitBreaker(5, Duration.ofMinutes(1)),
                        new RoundRobinSelector<>(), Duration.ZERO, (kind, id, ok, err) -> { }, Clock.systemUTC()));
        Mockito.when(writer.write(Mockito.eq(campaign.getId()), Mockito.anyList(), Mockito.any(), Mockito.anyLong(), Mockito.any()))
                .thenAnswer(inv -> ((List<?>) inv.getArgument(1)).size());
    }

    @SuppressWarnings("unchecked")
    private List<DnsValidationResult> writtenResults() {
        ArgumentCaptor<List<DnsValidationResult>> captor = ArgumentCaptor.forClass(List.class);
        Mockito.verify(writer).write(Mockito.eq(campaign.getId()), captor.capture(), Mockito.any(), Mockito.anyLong(), Mockito.any());
        return captor.getValue();
    }

    @Test
    void transportFailure_isRetriedOnADifferentPersona() {
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of("aatest.com"));
        Mockito.when(candidateSource.eligibleCount(source)).thenReturn(9L);
        Mockito.when(resolver.lookup(Mockito.eq("aatest.com"), Mockito.eq(flakyConfig), Mockito.any()))
                .thenThrow(new TransportException("connection refused", false));
        Mockito.when(resolver.lookup(Mockito.eq("aatest.com"), Mockito.eq(goodConfig), Mockito.any()))
                .thenReturn(new DnsLookup(true, List.of("93.184.216.34"), "10.0.0.2"));

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(job, lease));

        List<DnsValidationResult> results = writtenResults();
        Assertions.assertEquals(1, results.size());
        DnsValidationResult r = results.get(0);
        Assertions.assertEquals(DnsValidationStatus.RESOLVED, r.getDnsStatus());
        Assertions.assertEquals(SystemStatus.SUCCEEDED, r.getSystemStatus());
        Assertions.assertEquals("p2", r.getPersonaId());
        Assertions.assertEquals(2, r.getAttempts());
        Assertions.assertEquals(List.of("93.184.216.34"), r.getResolvedAddresses());
        Mockito.verify(writer).write(Mockito.eq(campaign.getId()), Mockito.anyList(), Mockito.any(), Mockito.eq(9L), Mockito.any());
        Mockito.verify(scheduler).renewLease(job.getId(), "w-1");
    }

    @Test
    void allAttemptsTimingOut_recordsErrorVerdict() {
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of("slow.com"));
        Mockito.when(resolver.lookup(Mockito.eq("slow.com"), Mockito.any(), Mockito.any()))
                .thenThrow(new TransportException("timed out", true));

        Assertions.assertEquals(JobOutcome.CONTINUE, service.execute(job, lease));

        DnsValidationResult r = writtenResults().get(0);
        Assertions.assertEquals(DnsValidationStatus.ERROR, r.getDnsStatus());
        Assertions.assertEquals(SystemStatus.TIMED_OUT, r.getSystemStatus());
        Assertions.assertEquals(2, r.getAttempts());
        Assertions.assertEquals("timed out", r.getErrorMessage());
    }

    @Test
    void authoritativeNoSuchName_isUnresolvedNotAnError() {
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of("nothing.com"));
        Mockito.when(resolver.lookup(Mockito.eq("nothing.com"), Mockito.any(), Mockito.any()))
                .thenReturn(new DnsLookup(false, List.of(), "10.0.0.1"));

        service.execute(job, lease);

        DnsValidationResult r = writtenResults().get(0);
        Assertions.assertEquals(DnsValidationStatus.UNRESOLVED, r.getDnsStatus());
        Assertions.assertEquals(1, r.getAttempts());
    }

    @Test
    void noCandidates_whileSourceRuns_waits() {
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of());

        Assertions.assertEquals(JobOutcome.WAIT, service.execute(job, lease));
        Mockito.verify(stateService, Mockito.never()).complete(Mockito.anyString());
        Mockito.verifyNoInteractions(writer);
    }

    @Test
    void noCandidates_afterSourceFinished_completes() {
        source.setStatus(CampaignStatus.COMPLETED);
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of());

        Assertions.assertEquals(JobOutcome.COMPLETED, service.execute(job, lease));
        Mockito.verify(stateService).complete(campaign.getId());
    }

    @Test
    void emptyPersonaPool_degradesCampaign() {
        Mockito.when(candidateSource.next(campaign, source, 10)).thenReturn(List.of("a.com"));
        Mockito.when(poolManager.personaPool(List.of("p1", "p2"), PersonaType.DNS, SelectionStrategy.ROUND_ROBIN, 0))
                .thenReturn(new ResourcePool<>("dns personas", List.of(), new CircuitBreaker(5, Duration.ofMinutes(1)),
                        new RoundRobinSelector<>(), Duration.ZERO, (kind, id, ok, err) -> { }, Clock.systemUTC()));

        Assertions.assertEquals(JobOutcome.ABANDONED, service.execute(job, lease));
        Mockito.verify(stateService).degrade(Mockito.eq(campaign.getId()), Mockito.anyString());
        Mockito.verifyNoInteractions(resolver, writer);
    }
}
