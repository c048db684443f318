package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.DomainGenerationParams;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link DomainGenerationParams}.
 */
public interface DomainGenerationParamsRepository extends JpaRepository<DomainGenerationParams, String> {
}
