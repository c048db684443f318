package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.GenerationConfig;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link GenerationConfig}.
 */
public interface GenerationConfigRepository extends JpaRepository<GenerationConfig, String> {

    /**
     * Moves the cursor from {@code expected} to {@code next} if nobody moved it in between.
     *
     * @param fingerprint config key
     * @param expected    offset the caller read
     * @param next        new offset
     * @param now         update time
     * @return 1 on success, 0 when the offset changed concurrently
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update GenerationConfig g
            set g.currentOffset = :next, g.updatedAt = :now
            where g.fingerprint = :fingerprint and g.currentOffset = :expected
            """)
    int advanceOffset(@Param("fingerprint") String fingerprint,
                      @Param("expected") long expected,
                      @Param("next") long next,
                      @Param("now") Instant now);
}
