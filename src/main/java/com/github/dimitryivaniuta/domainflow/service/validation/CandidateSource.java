package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignType;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationStatus;
import com.github.dimitryivaniuta.domainflow.repo.DnsValidationResultRepository;
import com.github.dimitryivaniuta.domainflow.repo.GeneratedDomainRepository;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads eligible predecessor rows that a validation campaign has not checked yet.
 *
 * <p>Eligible rows are every generated domain of a generation source, or the RESOLVED results of a
 * DNS source. The predecessor's rows are only read, never updated.</p>
 */
@Component
public class CandidateSource {

    private final GeneratedDomainRepository generatedDomainRepository;
    private final DnsValidationResultRepository dnsResultRepository;

    public CandidateSource(GeneratedDomainRepository generatedDomainRepository,
                           DnsValidationResultRepository dnsResultRepository) {
        this.generatedDomainRepository = generatedDomainRepository;
        this.dnsResultRepository = dnsResultRepository;
    }

    /**
     * Next unchecked domain names, in predecessor order.
     *
     * @param campaign consuming campaign
     * @param source   its admitted source
     * @param limit    batch size
     * @return domain names
     */
    @Transactional(readOnly = true, propagation = Propagation.SUPPORTS)
    public List<String> next(Campaign campaign, Campaign source, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (campaign.getType() == CampaignType.DNS_VALIDATION) {
            return generatedDomainRepository.findUncheckedByDns(source.getId(), campaign.getId(), page);
        }
        if (source.getType() == CampaignType.DNS_VALIDATION) {
            return dnsResultRepository.findResolvedUncheckedByHttp(source.getId(), campaign.getId(), page);
        }
        return generatedDomainRepository.findUncheckedByHttp(source.getId(), campaign.getId(), page);
    }

    /**
     * Number of eligible rows the source has produced so far.
     *
     * @param source predecessor campaign
     * @return eligible row count
     */
    @Transactional(readOnly = true, propagation = Propagation.SUPPORTS)
    public long eligibleCount(Campaign source) {
        if (source.getType() == CampaignType.DOMAIN_GENERATION) {
            return generatedDomainRepository.countByCampaignId(source.getId());
        }
        if (source.getType() == CampaignType.DNS_VALIDATION) {
            return dnsResultRepository.countByCampaignIdAndDnsStatus(source.getId(), DnsValidationStatus.RESOLVED);
        }
        return 0L;
    }
}
