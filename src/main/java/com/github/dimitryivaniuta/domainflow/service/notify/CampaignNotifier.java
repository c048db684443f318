package com.github.dimitryivaniuta.domainflow.service.notify;

/**
 * Outbound side of campaign notifications. Implementations must not require acknowledgements.
 */
public interface CampaignNotifier {

    void publish(CampaignEventMessage message);
}
