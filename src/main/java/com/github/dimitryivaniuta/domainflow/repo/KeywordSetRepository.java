package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link KeywordSet}.
 */
public interface KeywordSetRepository extends JpaRepository<KeywordSet, String> {
}
