package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.HttpKeywordParams;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link HttpKeywordParams}.
 */
public interface HttpKeywordParamsRepository extends JpaRepository<HttpKeywordParams, String> {
}
