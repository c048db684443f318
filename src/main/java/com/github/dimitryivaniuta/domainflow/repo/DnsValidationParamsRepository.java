package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.DnsValidationParams;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link DnsValidationParams}.
 */
public interface DnsValidationParamsRepository extends JpaRepository<DnsValidationParams, String> {
}
