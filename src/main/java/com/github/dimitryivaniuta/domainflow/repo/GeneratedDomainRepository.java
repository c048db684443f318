package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.GeneratedDomain;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link GeneratedDomain}.
 */
public interface GeneratedDomainRepository extends JpaRepository<GeneratedDomain, String> {

    @Query("select d.domainName from GeneratedDomain d where d.campaignId = :campaignId and d.domainName in :names")
    List<String> findExistingNames(@Param("campaignId") String campaignId, @Param("names") Collection<String> names);

    long countByCampaignId(String campaignId);

    List<GeneratedDomain> findByCampaignIdOrderByOffsetIndexAsc(String campaignId, Pageable pageable);

    /**
     * Generated domains of {@code sourceId} not yet checked by DNS campaign {@code campaignId}.
     */
    @Query("""
            select d.domainName from GeneratedDomain d
            where d.campaignId = :sourceId
              and not exists (
                select 1 from DnsValidationResult r
                where r.campaignId = :campaignId and r.domainName = d.domainName)
            order by d.offsetIndex asc
            """)
    List<String> findUncheckedByDns(@Param("sourceId") String sourceId,
                                    @Param("campaignId") String campaignId,
                                    Pageable pageable);

    /**
     * Generated domains of {@code sourceId} not yet checked by HTTP campaign {@code campaignId}.
     */
    @Query("""
            select d.domainName from GeneratedDomain d
            where d.campaignId = :sourceId
              and not exists (
                select 1 from HttpKeywordResult r
                where r.campaignId = :campaignId and r.domainName = d.domainName)
            order by d.offsetIndex asc
            """)
    List<String> findUncheckedByHttp(@Param("sourceId") String sourceId,
                                     @Param("campaignId") String campaignId,
                                     Pageable pageable);
}
