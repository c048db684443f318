package com.github.dimitryivaniuta.domainflow.service.error;

public class CampaignNotFoundException extends RuntimeException {

    public CampaignNotFoundException(String campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
