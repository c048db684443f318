package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordResult;
import com.github.dimitryivaniuta.domainflow.domain.HttpValidationStatus;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link HttpKeywordResult}.
 */
public interface HttpKeywordResultRepository extends JpaRepository<HttpKeywordResult, String> {

    @Query("select r.domainName from HttpKeywordResult r where r.campaignId = :campaignId and r.domainName in :names")
    List<String> findExistingNames(@Param("campaignId") String campaignId, @Param("names") Collection<String> names);

    long countByCampaignId(String campaignId);

    long countByCampaignIdAndHttpStatus(String campaignId, HttpValidationStatus httpStatus);

    List<HttpKeywordResult> findByCampaignIdOrderByKeywordScoreDesc(String campaignId);
}
