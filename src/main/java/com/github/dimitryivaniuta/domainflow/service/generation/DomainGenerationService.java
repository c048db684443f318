package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import com.github.dimitryivaniuta.domainflow.domain.GenerationConfig;
import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.domain.JobType;
import com.github.dimitryivaniuta.domainflow.repo.DomainGenerationParamsRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import com.github.dimitryivaniuta.domainflow.service.scheduler.CampaignJobHandler;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobLease;
import com.github.dimitryivaniuta.domainflow.service.scheduler.JobOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Generation stage: reserves an offset range on the shared cursor, enumerates it and writes the
 * domains. One range per job execution.
 */
@Service
public class DomainGenerationService implements CampaignJobHandler {

    private static final Logger log = LoggerFactory.getLogger(DomainGenerationService.class);

    private final DomainGenerationParamsRepository paramsRepository;
    private final GenerationCursorStore cursorStore;
    private final GenerationBatchWriter batchWriter;
    private final CampaignStateService campaignStateService;
    private final AppProperties properties;
    private final Counter generatedCounter;

    public DomainGenerationService(DomainGenerationParamsRepository paramsRepository,
                                   GenerationCursorStore cursorStore,
                                   GenerationBatchWriter batchWriter,
                                   CampaignStateService campaignStateService,
                                   AppProperties properties,
                                   MeterRegistry meterRegistry) {
        this.paramsRepository = paramsRepository;
        this.cursorStore = cursorStore;
        this.batchWriter = batchWriter;
        this.campaignStateService = campaignStateService;
        this.properties = properties;
        this.generatedCounter = Counter.builder("domainflow.generation.domains").register(meterRegistry);
    }

    @Override
    public JobType jobType() {
        return JobType.DOMAIN_GENERATION;
    }

    @Override
    public JobOutcome execute(CampaignJob job, JobLease lease) {
        String campaignId = job.getCampaignId();
        DomainGenerationParams params = paramsRepository.findById(campaignId).orElse(null);
        if (params == null) {
            campaignStateService.fail(campaignId, "Missing generation parameters");
            return JobOutcome.FAILED;
        }
        long remaining = params.remaining();
        if (remaining == 0) {
            campaignStateService.complete(campaignId);
            return JobOutcome.COMPLETED;
        }

        GenerationSpec spec = params.toSpec();
        long capacity;
        try {
            capacity = PatternEnumerator.capacity(spec);
        } catch (InvalidConfigException e) {
            campaignStateService.fail(campaignId, e.getMessage());
            return JobOutcome.FAILED;
        }
        GenerationConfig config = cursorStore.obtain(params.getConfigFingerprint(), spec, capacity);
        int batchSize = params.getBatchSize() > 0 ? params.getBatchSize() : properties.getGeneration().getDefaultBatchSize();
        long requested = Math.min(batchSize, remaining);

        long started = System.nanoTime();
        OffsetRange range = cursorStore.reserve(config.getFingerprint(), requested);
        if (range.isEmpty()) {
            log.info("Campaign {}: pattern {} exhausted at offset {}, completing with {} of {} domains",
                    campaignId, config.getFingerprint(), range.start(), params.getGeneratedCount(), params.getNumDomainsToGenerate());
            campaignStateService.complete(campaignId);
            return JobOutcome.COMPLETED;
        }
        List<String> domains = PatternEnumerator.enumerate(spec, range);

        lease.renew();
        int maxAttempts = Math.max(1, properties.getGeneration().getMaxWriteAttempts());
        long generated = -1L;
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts && generated < 0; attempt++) {
            try {
                generated = batchWriter.write(campaignId, domains, range.start(),
                        Duration.ofNanos(System.nanoTime() - started));
            } catch (DataAccessException | TransactionException e) {
                lastError = e;
                log.warn("Campaign {}: writing range [{}, {}) failed (attempt {}/{}): {}",
                        campaignId, range.start(), range.endExclusive(), attempt, maxAttempts, e.getMessage());
            }
        }
        if (generated < 0) {
            campaignStateService.fail(campaignId, "Writing generated domains failed after " + maxAttempts
                    + " attempts: " + ErrorMessages.safe(lastError));
            return JobOutcome.FAILED;
        }
        generatedCounter.increment(domains.size());
        log.info("Campaign {}: generated offsets [{}, {}), {} of {} domains",
                campaignId, range.start(), range.endExclusive(), generated, params.getNumDomainsToGenerate());

        boolean clipped = range.size() < requested;
        if (generated >= params.getNumDomainsToGenerate() || clipped) {
            campaignStateService.complete(campaignId);
            return JobOutcome.COMPLETED;
        }
        return JobOutcome.CONTINUE;
    }
}
