package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.campaign.CampaignStateService;
import com.github.dimitryivaniuta.domainflow.service.progress.ProgressAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Collaborators shared by every validation stage.
 */
@Component
public record StageSupport(
        CampaignRepository campaignRepository,
        StageAdmission admission,
        CandidateSource candidateSource,
        CampaignStateService campaignStateService,
        ProgressAggregator progressAggregator,
        ValidationResultWriter resultWriter,
        PlatformTransactionManager transactionManager,
        MeterRegistry meterRegistry,
        @Qualifier("validationExecutor") AsyncTaskExecutor validationExecutor,
        CampaignRateLimiters rateLimiters
) {
}
