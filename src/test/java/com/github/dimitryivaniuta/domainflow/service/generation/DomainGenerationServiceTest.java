package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import com.github.dimitryivaniuta.domainflow.domain.GenerationConfig;
import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.domain.PatternType;
import com.github.dimitryivaniuta.domainflow.repo.DomainGenerationParamsRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobLease;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobOutcome;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Batch logic of the generation stage with the cursor store and writer mocked.
 */
class DomainGenerationServiceTest {

    private static final String CAMPAIGN = "c-1";
    private static final String FP = "f".repeat(64);

    private final DomainGenerationParamsRepository paramsRepository = Mockito.mock(DomainGenerationParamsRepository.class);
    private final GenerationCursorStore cursorStore = Mockito.mock(GenerationCursorStore.class);
    private final GenerationBatchWriter writer = Mockito.mock(GenerationBatchWriter.class);
    private final CampaignStateService stateService = Mockito.mock(CampaignStateService.class);
    private final JobScheduler scheduler = Mockito.mock(JobScheduler.class);
    private final AppProperties properties = new AppProperties();

    private DomainGenerationService service;
    private DomainGenerationParams params;
    private final CampaignJob job = CampaignJob.pending(CAMPAIGN, JobType.DOMAIN_GENERATION, 5, 3, 600, Instant.now());
    private final JobLease lease = new JobLease(job.getId(), "w-1", scheduler);

    @BeforeEach
    void setUp() {
        service = new DomainGenerationService(paramsRepository, cursorStore, writer, stateService, properties, new SimpleMeterRegistry());

        GenerationSpec spec = GenerationSpec.normalize(PatternType.PREFIX, "abc", "test", 2, "com");
        params = new DomainGenerationParams();
        params.setCampaignId(CAMPAIGN);
        params.setPatternType(spec.patternType());
        params.setCharacterSet(spec.characterSet());
        params.setConstantString(spec.constantString());
        params.setVariableLength(spec.variableLength());
        params.setTld(spec.tld());
        params.setNumDomainsToGenerate(9);
        params.setBatchSize(4);
        params.setConfigFingerprint(FP);

        Mockito.when(paramsRepository.findById(CAMPAIGN)).thenReturn(Optional.of(params));
        Mockito.when(cursorStore.obtain(Mockito.eq(FP), Mockito.any(), Mockito.eq(9L)))
                .thenReturn(GenerationConfig.fresh(FP, spec, 9));
    }

    @Test
    void firstBatch_writesReservedRange_andContinues() {
        Mockito.when(cursorStore.reserve(FP, 4)).thenReturn(new OffsetRange(0, 4));
        Mockito.when(writer.write(Mockito.eq(CAMPAIGN), Mockito.anyList(), Mockito.eq(0L), Mockito.any())).thenReturn(4L);

        JobOutcome outcome = service.execute(job, lease);

        Assertions.assertEquals(JobOutcome.CONTINUE, outcome);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> domains = ArgumentCaptor.forClass(List.class);
        Mockito.verify(writer).write(Mockito.eq(CAMPAIGN), domains.capture(), Mockito.eq(0L), Mockito.any());
        Assertions.assertEquals(List.of("aatest.com", "abtest.com", "actest.com", "batest.com"), domains.getValue());
        Mockito.verify(scheduler).renewLease(job.getId(), "w-1");
        Mockito.verify(stateService, Mockito.never()).complete(Mockito.anyString());
    }

    @Test
    void lastBatch_requestsOnlyTheRemainder_andCompletes() {
        params.setGeneratedCount(8);
        Mockito.when(cursorStore.reserve(FP, 1)).thenReturn(new OffsetRange(8, 9));
        Mockito.when(writer.write(Mockito.eq(CAMPAIGN), Mockito.eq(List.of("cctest.com")), Mockito.eq(8L), Mockito.any())).thenReturn(9L);

        Assertions.assertEquals(JobOutcome.COMPLETED, service.execute(job, lease));
        Mockito.verify(stateService).complete(CAMPAIGN);
    }

    @Test
    void exhaustedCursor_completesWithoutWriting() {
        Mockito.when(cursorStore.reserve(FP, 4)).thenReturn(new OffsetRange(9, 9));

        Assertions.assertEquals(JobOutcome.COMPLETED, service.execute(job, lease));
        Mockito.verify(stateService).complete(CAMPAIGN);
        Mockito.verifyNoInteractions(writer);
    }

    @Test
    void clippedRange_completesEarly() {
        params.setNumDomainsToGenerate(100);
        params.setBatchSize(50);
        Mockito.when(cursorStore.obtain(Mockito.eq(FP), Mockito.any(), Mockito.eq(9L)))
                .thenReturn(GenerationConfig.fresh(FP, params.toSpec(), 9));
        Mockito.when(cursorStore.reserve(FP, 50)).thenReturn(new OffsetRange(5, 9));
        Mockito.when(writer.write(Mockito.eq(CAMPAIGN), Mockito.anyList(), Mockito.eq(5L), Mockito.any())).thenReturn(4L);

        Assertions.assertEquals(JobOutcome.COMPLETED, service.execute(job, lease));
        Mockito.verify(stateService).complete(CAMPAIGN);
    }

    @Test
    void writeFailingEveryAttempt_failsCampaign() {
        Mockito.when(cursorStore.reserve(FP, 4)).thenReturn(new OffsetRange(0, 4));
        Mockito.when(writer.write(Mockito.eq(CAMPAIGN), Mockito.anyList(), Mockito.eq(0L), Mockito.any()))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        Assertions.assertEquals(JobOutcome.FAILED, service.execute(job, lease));
        Mockito.verify(writer, Mockito.times(properties.getGeneration().getMaxWriteAttempts()))
                .write(Mockito.eq(CAMPAIGN), Mockito.anyList(), Mockito.eq(0L), Mockito.any());
        Mockito.verify(stateService).fail(Mockito.eq(CAMPAIGN), Mockito.contains("db down"));
    }

    @Test
    void missingParams_failsCampaign() {
        Mockito.when(paramsRepository.findById(CAMPAIGN)).thenReturn(Optional.empty());

        Assertions.assertEquals(JobOutcome.FAILED, service.execute(job, lease));
        Mockito.verify(stateService).fail(Mockito.eq(CAMPAIGN), Mockito.anyString());
    }

    @Test
    void targetAlreadyReached_completesImmediately() {
        params.setGeneratedCount(9);

        Assertions.assertEquals(JobOutcome.COMPLETED, service.execute(job, lease));
        Mockito.verifyNoInteractions(cursorStore, writer);
    }
}
