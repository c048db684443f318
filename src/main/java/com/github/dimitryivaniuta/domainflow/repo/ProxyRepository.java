package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.Proxy;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/**
 * Repository for {@link Proxy}.
 */
public interface ProxyRepository extends JpaRepository<Proxy, String> {

    /**
     * Enabled resources whose circuit is open, candidates for a health probe.
     *
     * @return open-circuit resources
     */
    @Query("select r from Proxy r where r.enabled = true and r.health.healthy = false")
    List<Proxy> findOpenCircuits();
}
