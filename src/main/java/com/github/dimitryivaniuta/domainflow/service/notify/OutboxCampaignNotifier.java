package com.github.dimitryivaniuta.domainflow.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.domainflow.domain.OutboxEvent;
import com.github.dimitryivaniuta.domainflow.repo.OutboxEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes notifications to the outbox inside the caller's transaction.
 */
@Service
public class OutboxCampaignNotifier implements CampaignNotifier {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    public OutboxCampaignNotifier(OutboxEventRepository outboxEventRepository, ObjectMapper objectMapper) {
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(CampaignEventMessage message) {
        try {
            String payload = objectMapper.writeValueAsString(message);
            outboxEventRepository.save(OutboxEvent.newEvent(message.campaignId(), message.type(), payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + message.type() + " event", e);
        }
    }
}
