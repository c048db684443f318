package com.github.dimitryivaniuta.domainflow.service.error;

import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;

/**
 * Requested lifecycle operation is not allowed from the campaign's current status.
 */
public class IllegalCampaignTransitionException extends RuntimeException {

    public IllegalCampaignTransitionException(String campaignId, CampaignStatus from, CampaignStatus to) {
        super("Campaign " + campaignId + " cannot move from " + from + " to " + to);
    }
}
