package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.OutboxEvent;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link OutboxEvent}.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Locks the next due batch of campaign events, oldest first.
     *
     * <p>{@code FOR UPDATE SKIP LOCKED} lets several dispatcher instances drain the table without
     * sending an event twice.</p>
     *
     * @param statuses statuses to fetch (NEW, RETRY)
     * @param now      current time
     * @param limit    batch size
     * @return locked batch
     */
    @Query(value = """
            select *
            from outbox_events
            where status in (:statuses)
              and (next_attempt_at is null or next_attempt_at <= :now)
            order by created_at
            limit :limit
            for update skip locked
            """, nativeQuery = true)
    List<OutboxEvent> lockNextBatchForPublish(
            @Param("statuses") List<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    List<OutboxEvent> findByCampaignIdOrderByCreatedAtAsc(String campaignId);
}
