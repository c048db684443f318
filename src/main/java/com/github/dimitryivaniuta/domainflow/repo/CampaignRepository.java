package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.Campaign;
import com.github.dimitryivaniuta.domainflow.domain.CampaignStatus;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link Campaign}.
 */
public interface CampaignRepository extends JpaRepository<Campaign, String> {

    /**
     * Loads a campaign under a row lock. Every counter or status change goes through this so that
     * concurrent batch commits serialise per campaign.
     *
     * @param id campaign id
     * @return locked campaign
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Campaign c where c.id = :id")
    Optional<Campaign> findByIdForUpdate(@Param("id") String id);

    List<Campaign> findByStatus(CampaignStatus status);

    List<Campaign> findBySourceCampaignId(String sourceCampaignId);
}
