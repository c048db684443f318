package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Kind of work a job performs; one per campaign type.
 */
public enum JobType {
    DOMAIN_GENERATION,
    DNS_VALIDATION,
    HTTP_KEYWORD_VALIDATION;

    /**
     * Maps a campaign type to the job type that drives it.
     *
     * @param type campaign type
     * @return job type
     */
    public static JobType forCampaign(CampaignType type) {
        switch (type) {
            case DOMAIN_GENERATION:
                return DOMAIN_GENERATION;
            case DNS_VALIDATION:
                return DNS_VALIDATION;
            default:
                return HTTP_KEYWORD_VALIDATION;
        }
    }
}
