package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.DnsValidationResult;
import com.github.dimitryivaniuta.domainflow.domain.DnsValidationStatus;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link DnsValidationResult}.
 */
public interface DnsValidationResultRepository extends JpaRepository<DnsValidationResult, String> {

    @Query("select r.domainName from DnsValidationResult r where r.campaignId = :campaignId and r.domainName in :names")
    List<String> findExistingNames(@Param("campaignId") String campaignId, @Param("names") Collection<String> names);

    long countByCampaignId(String campaignId);

    long countByCampaignIdAndDnsStatus(String campaignId, DnsValidationStatus dnsStatus);

    List<DnsValidationResult> findByCampaignIdOrderByCheckedAtAsc(String campaignId);

    /**
     * Resolved domains of DNS campaign {@code sourceId} not yet checked by HTTP campaign {@code campaignId}.
     */
    @Query("""
            select r.domainName from DnsValidationResult r
            where r.campaignId = :sourceId
              and r.dnsStatus = com.github.dimitryivaniuta.domainflow.domain.DnsValidationStatus.RESOLVED
              and not exists (
                select 1 from HttpKeywordResult h
                where h.campaignId = :campaignId and h.domainName = r.domainName)
            order by r.checkedAt asc, r.id asc
            """)
    List<String> findResolvedUncheckedByHttp(@Param("sourceId") String sourceId,
                                             @Param("campaignId") String campaignId,
                                             Pageable pageable);
}
