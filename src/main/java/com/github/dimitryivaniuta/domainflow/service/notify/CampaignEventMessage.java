package com.github.dimitryivaniuta.domainflow.service.notify;

import java.time.Instant;

/**
 * Message pushed to the notifier.
 *
 * @param campaignId campaign the event is about
 * @param type       one of {@link #PROGRESS}, {@link #STATUS}, {@link #DEGRADED}
 * @param data       type-specific payload
 * @param timestamp  event time
 */
public record CampaignEventMessage(String campaignId, String type, Object data, Instant timestamp) {

    public static final String PROGRESS = "campaign.progress";
    public static final String STATUS = "campaign.status";
    public static final String DEGRADED = "campaign.degraded";
}
