package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.CampaignJob;
import com.github.dimitryivaniuta.domainflow.domain.JobStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link CampaignJob}.
 *
 * <p>The {@code @Modifying} updates are the scheduler's compare-and-swap primitives: each carries the
 * expected current state in its {@code where} clause and returns the number of rows changed, so a
 * result of 0 means another worker got there first.</p>
 */
public interface CampaignJobRepository extends JpaRepository<CampaignJob, String> {

    /**
     * Claim candidates in dispatch order.
     *
     * @param now      current time
     * @param pageable how many candidates to look at
     * @return pending jobs that are due
     */
    @Query("""
            select j from CampaignJob j
            where j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.PENDING
              and j.nextExecutionAt <= :now
            order by j.priority desc, j.scheduledAt asc, j.id asc
            """)
    List<CampaignJob> findClaimCandidates(@Param("now") Instant now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.LOCKED,
                j.lockedBy = :workerId, j.lockedAt = :now, j.processingServerId = :workerId, j.updatedAt = :now
            where j.id = :id
              and j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.PENDING
              and j.lockedBy is null
            """)
    int tryLock(@Param("id") String id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.RUNNING,
                j.lastAttemptedAt = :now, j.updatedAt = :now
            where j.id = :id and j.lockedBy = :workerId
              and j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.LOCKED
            """)
    int markRunning(@Param("id") String id, @Param("workerId") String workerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.lockedAt = :now, j.updatedAt = :now
            where j.id = :id and j.lockedBy = :workerId
              and j.status in (com.github.dimitryivaniuta.domainflow.domain.JobStatus.LOCKED,
                               com.github.dimitryivaniuta.domainflow.domain.JobStatus.RUNNING)
            """)
    int renewLease(@Param("id") String id, @Param("workerId") String workerId, @Param("now") Instant now);

    /**
     * Releases a lease held by {@code workerId}, moving the job to {@code status}.
     *
     * @return 1 if this worker still held the lease
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.status = :status, j.lockedBy = null, j.lockedAt = null,
                j.attempts = j.attempts + :attemptDelta, j.nextExecutionAt = :nextExecutionAt,
                j.lastError = :lastError, j.updatedAt = :now
            where j.id = :id and j.lockedBy = :workerId
              and j.status in (com.github.dimitryivaniuta.domainflow.domain.JobStatus.LOCKED,
                               com.github.dimitryivaniuta.domainflow.domain.JobStatus.RUNNING)
            """)
    int release(@Param("id") String id,
                @Param("workerId") String workerId,
                @Param("status") JobStatus status,
                @Param("attemptDelta") int attemptDelta,
                @Param("nextExecutionAt") Instant nextExecutionAt,
                @Param("lastError") String lastError,
                @Param("now") Instant now);

    /**
     * Reclaims an expired lease. Matches on the observed {@code lockedAt} so a lease renewed or
     * released after the sweep read it is left alone.
     *
     * @return 1 when reclaimed
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.status = :status, j.lockedBy = null, j.lockedAt = null,
                j.attempts = j.attempts + 1, j.nextExecutionAt = :nextExecutionAt,
                j.lastError = :lastError, j.updatedAt = :now
            where j.id = :id and j.lockedBy = :lockedBy and j.lockedAt = :lockedAt
            """)
    int reclaim(@Param("id") String id,
                @Param("lockedBy") String lockedBy,
                @Param("lockedAt") Instant lockedAt,
                @Param("status") JobStatus status,
                @Param("nextExecutionAt") Instant nextExecutionAt,
                @Param("lastError") String lastError,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update CampaignJob j
            set j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.PENDING, j.updatedAt = :now
            where j.status = com.github.dimitryivaniuta.domainflow.domain.JobStatus.RETRY_PENDING
              and j.nextExecutionAt <= :now
            """)
    int promoteDueRetries(@Param("now") Instant now);

    List<CampaignJob> findByStatusIn(Collection<JobStatus> statuses);

    List<CampaignJob> findByCampaignIdOrderByCreatedAtAsc(String campaignId);

    boolean existsByCampaignIdAndStatusIn(String campaignId, Collection<JobStatus> statuses);
}
