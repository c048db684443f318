package com.github.dimitryivaniuta.domainflow.service.progress;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.OutboxEvent;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.domainflow.service.notify.CampaignEventMessage;
import com.github.dimitryivaniuta.domainflow.service.notify.OutboxCampaignNotifier;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
class ProgressAggregatorTest {

    @Autowired
    CampaignRepository campaignRepository;

    @Autowired
    OutboxEventRepository outboxEventRepository;

    private ProgressAggregator aggregator;
    private Campaign campaign;

    @BeforeEach
    void setUp() {
        OutboxCampaignNotifier notifier = new OutboxCampaignNotifier(outboxEventRepository,
                JsonMapper.builder().addModule(new JavaTimeModule()).build());
        aggregator = new ProgressAggregator(campaignRepository, notifier, new ProgressSnapshotCache(campaignRepository),
                new AppProperties());
        campaign = Campaign.newPending("dns", CampaignType.DNS_VALIDATION, "gen-1", CampaignType.DOMAIN_GENERATION);
        campaignRepository.saveAndFlush(campaign);
    }

    private static void assertCounterInvariants(ProgressSnapshot s) {
        Assertions.assertTrue(s.processedItems() <= s.totalItems(), "processed > total");
        Assertions.assertTrue(s.successfulItems() + s.failedItems() <= s.processedItems(), "successful + failed > processed");
        Assertions.assertTrue(s.progressPercentage() >= 0 && s.progressPercentage() <= 100);
    }

    @Test
    void batches_accumulateCountersAndPercentage() {
        ProgressSnapshot first = aggregator.apply(campaign.getId(), new ProgressDelta(9, 4, 3, 1, Duration.ofSeconds(2)));
        assertCounterInvariants(first);
        Assertions.assertEquals(9, first.totalItems());
        Assertions.assertEquals(4, first.processedItems());
        Assertions.assertEquals(44.44, first.progressPercentage(), 0.01);
        Assertions.assertEquals(2.0, first.avgProcessingRate(), 1e-9);
        Assertions.assertNotNull(first.estimatedCompletionAt());

        ProgressSnapshot second = aggregator.apply(campaign.getId(), new ProgressDelta(9, 5, 5, 0, Duration.ofSeconds(1)));
        assertCounterInvariants(second);
        Assertions.assertEquals(9, second.processedItems());
        Assertions.assertEquals(8, second.successfulItems());
        Assertions.assertEquals(100.0, second.progressPercentage(), 1e-9);

        Campaign stored = campaignRepository.findById(campaign.getId()).orElseThrow();
        Assertions.assertEquals(9, stored.getProcessedItems());
        Assertions.assertNotNull(stored.getLastHeartbeatAt());
    }

    @Test
    void totalGrowsWithTheSource_andNeverShrinksWhileRunning() {
        aggregator.apply(campaign.getId(), new ProgressDelta(10, 5, 5, 0, Duration.ZERO));
        ProgressSnapshot s = aggregator.apply(campaign.getId(), new ProgressDelta(4, 2, 1, 1, Duration.ZERO));

        assertCounterInvariants(s);
        Assertions.assertEquals(10, s.totalItems());
        Assertions.assertEquals(7, s.processedItems());
    }

    @Test
    void processedBeyondTotal_raisesTotal() {
        ProgressSnapshot s = aggregator.apply(campaign.getId(), new ProgressDelta(3, 5, 5, 0, Duration.ZERO));

        assertCounterInvariants(s);
        Assertions.assertEquals(5, s.totalItems());
    }

    @Test
    void settle_shrinksTotalToProcessed() {
        campaign.setTotalItems(100);
        campaignRepository.saveAndFlush(campaign);
        aggregator.apply(campaign.getId(), new ProgressDelta(100, 9, 9, 0, Duration.ZERO));

        Campaign locked = campaignRepository.findByIdForUpdate(campaign.getId()).orElseThrow();
        aggregator.settle(locked);

        Assertions.assertEquals(9, locked.getTotalItems());
        Assertions.assertEquals(100.0, locked.getProgressPercentage(), 1e-9);
    }

    @Test
    void everyBatch_writesAProgressNotification() {
        aggregator.apply(campaign.getId(), new ProgressDelta(9, 4, 3, 1, Duration.ZERO));
        aggregator.apply(campaign.getId(), new ProgressDelta(9, 1, 1, 0, Duration.ZERO));

        List<OutboxEvent> events = outboxEventRepository.findAll().stream()
                .filter(e -> campaign.getId().equals(e.getCampaignId()))
                .toList();
        Assertions.assertEquals(2, events.size());
        Assertions.assertTrue(events.stream().allMatch(e -> CampaignEventMessage.PROGRESS.equals(e.getEventType())));
        Assertions.assertTrue(events.get(0).getPayload().contains("\"processedItems\""));
    }

    @Test
    void inconsistentDelta_isRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ProgressDelta(10, 2, 2, 1, Duration.ZERO));
    }
}
