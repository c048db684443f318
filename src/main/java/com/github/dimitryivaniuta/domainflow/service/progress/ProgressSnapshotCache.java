package com.github.dimitryivaniuta.domainflow.service.progress;

import static com.github.dimitryivaniuta.domainflow.config.CacheConfig.PROGRESS_CACHE;

import com.github.dimitryivaniuta.domainflow.repo.CampaignRepository;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Redis-backed cache of progress snapshots.
 *
 * <p>Postgres remains the source of truth; misses read the campaign row.</p>
 */
@Service
public class ProgressSnapshotCache {

    private final CampaignRepository campaignRepository;

    public ProgressSnapshotCache(CampaignRepository campaignRepository) {
        this.campaignRepository = campaignRepository;
    }

    /**
     * Snapshot of a campaign.
     *
     * @param campaignId campaign id
     * @return snapshot, or null for an unknown campaign
     */
    @Cacheable(cacheNames = PROGRESS_CACHE, key = "#campaignId", unless = "#result == null")
    @Transactional(readOnly = true)
    public ProgressSnapshot get(String campaignId) {
        return campaignRepository.findById(campaignId).map(ProgressSnapshot::from).orElse(null);
    }

    /**
     * Drops the cached snapshot after its campaign changed.
     *
     * @param campaignId campaign id
     */
    @CacheEvict(cacheNames = PROGRESS_CACHE, key = "#campaignId")
    public void evict(String campaignId) {
        // eviction is done by the cache interceptor
    }
}
