package com.github.dimitryivaniuta.domainflow.service.notify;

import com.github.dimitryivaniuta.domainflow.config.AppProperties;
import com.github.dimitryivaniuta.domainflow.domain.OutboxEvent;
import com.github.dimitryivaniuta.domainflow.domain.OutboxStatus;
import com.github.dimitryivaniuta.domainflow.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.domainflow.service.error.ErrorMessages;
import com.github.dimitryivaniuta.domainflow.service.scheduler.BackoffPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drains campaign notifications from the outbox onto Kafka.
 *
 * <p>Events are marked SENT only after the broker acknowledges them within {@code sendTimeout}.
 * Failed sends back off exponentially and become DEAD after {@code maxAttempts}.</p>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;
    private final BackoffPolicy backoff;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.backoff = new BackoffPolicy(properties.getOutbox().getBaseBackoff(), properties.getOutbox().getMaxBackoff());

        this.sentCounter = Counter.builder("domainflow.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("domainflow.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("domainflow.outbox.dead").register(meterRegistry);
    }

    /**
     * Publishes one batch of due events.
     *
     * @return number of events acknowledged
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public int publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();
        List<OutboxEvent> due = outboxEventRepository.lockNextBatchForPublish(
                List.of(OutboxStatus.NEW.name(), OutboxStatus.RETRY.name()), Instant.now(), outbox.getBatchSize());
        if (due.isEmpty()) {
            return 0;
        }

        Map<OutboxStatus, Integer> tally = new EnumMap<>(OutboxStatus.class);
        for (OutboxEvent event : due) {
            OutboxStatus after = deliver(event, outbox);
            outboxEventRepository.save(event);
            tally.merge(after, 1, Integer::sum);
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Outbox dispatch interrupted after event {}", event.getId());
                break;
            }
        }

        int sent = tally.getOrDefault(OutboxStatus.SENT, 0);
        log.debug("Outbox batch of {} on {}: {}", due.size(), outbox.getCampaignEventsTopic(), tally);
        return sent;
    }

    private OutboxStatus deliver(OutboxEvent event, AppProperties.Outbox outbox) {
        String error;
        try {
            kafkaTemplate.send(outbox.getCampaignEventsTopic(), event.getCampaignId(), event.getPayload())
                    .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            event.markSent();
            sentCounter.increment();
            return OutboxStatus.SENT;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            error = ErrorMessages.safe(ex);
        } catch (ExecutionException | TimeoutException | RuntimeException ex) {
            error = ErrorMessages.safe(ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex);
        }

        int attempt = event.getAttemptCount() + 1;
        if (attempt >= outbox.getMaxAttempts()) {
            event.markDead(error);
            deadCounter.increment();
            log.error("Campaign event {} [{}] for campaign {} is DEAD after {} attempts: {}",
                    event.getId(), event.getEventType(), event.getCampaignId(), attempt, error);
            return OutboxStatus.DEAD;
        }
        event.markRetry(error, backoff.delay(event.getAttemptCount()));
        retryCounter.increment();
        log.warn("Campaign event {} send failed (attempt {}), next try at {}: {}",
                event.getId(), event.getAttemptCount(), event.getNextAttemptAt(), error);
        return OutboxStatus.RETRY;
    }
}
