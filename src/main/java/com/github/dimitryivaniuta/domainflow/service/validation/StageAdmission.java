package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks a validation campaign's predecessor reference: the source must exist and be of exactly
 * the declared type, and that type must be one the stage can consume.
 */
@Component
public class StageAdmission {

    private final CampaignRepository campaignRepository;

    public StageAdmission(CampaignRepository campaignRepository) {
        this.campaignRepository = campaignRepository;
    }

    /**
     * Admits an existing campaign.
     *
     * @param campaign validation campaign
     * @return its source campaign
     * @throws InvalidConfigException when the reference is unusable
     */
    @Transactional(readOnly = true, propagation = Propagation.SUPPORTS)
    public Campaign admit(Campaign campaign) {
        return admit(campaign.getType(), campaign.getSourceCampaignId(), campaign.getSourceType());
    }

    /**
     * Admits a predecessor reference before the campaign exists.
     *
     * @param stageType          validation stage type
     * @param sourceCampaignId   referenced campaign id
     * @param declaredSourceType declared type of the referenced campaign
     * @return the source campaign
     * @throws InvalidConfigException when the reference is unusable
     */
    @Transactional(readOnly = true, propagation = Propagation.SUPPORTS)
    public Campaign admit(CampaignType stageType, String sourceCampaignId, CampaignType declaredSourceType) {
        if (sourceCampaignId == null || sourceCampaignId.isBlank()) {
            throw new InvalidConfigException(stageType.getSourceTypeName() + " campaign requires a source campaign");
        }
        if (declaredSourceType == null) {
            throw new InvalidConfigException(stageType.getSourceTypeName() + " campaign requires a source type");
        }
        if (!accepts(stageType, declaredSourceType)) {
            throw new InvalidConfigException(stageType.getSourceTypeName() + " campaign cannot consume "
                    + declaredSourceType.getSourceTypeName() + " results");
        }
        Campaign source = campaignRepository.findById(sourceCampaignId)
                .orElseThrow(() -> new InvalidConfigException("Source campaign not found: " + sourceCampaignId));
        if (source.getType() != declaredSourceType) {
            throw new InvalidConfigException("Source campaign " + sourceCampaignId + " is a "
                    + source.getType().getSourceTypeName() + " campaign, but source type "
                    + declaredSourceType.getSourceTypeName() + " was declared");
        }
        return source;
    }

    /**
     * Which predecessor types a stage consumes.
     *
     * @param stageType  consuming stage
     * @param sourceType predecessor stage
     * @return true when allowed
     */
    public static boolean accepts(CampaignType stageType, CampaignType sourceType) {
        switch (stageType) {
            case DNS_VALIDATION:
                return sourceType == CampaignType.DOMAIN_GENERATION;
            case HTTP_KEYWORD_VALIDATION:
                return sourceType == CampaignType.DOMAIN_GENERATION || sourceType == CampaignType.DNS_VALIDATION;
            default:
                return false;
        }
    }
}
