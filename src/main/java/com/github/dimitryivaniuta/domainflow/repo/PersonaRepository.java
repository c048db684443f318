package com.github.dimitryivaniuta.domainflow.repo;

import com.github.dimitryivaniuta.domainflow.domain.Persona;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/**
 * Repository for {@link Persona}.
 */
public interface PersonaRepository extends JpaRepository<Persona, String> {

    /**
     * Enabled resources whose circuit is open, candidates for a health probe.
     *
     * @return open-circuit resources
     */
    @Query("select r from Persona r where r.enabled = true and r.health.healthy = false")
    List<Persona> findOpenCircuits();
}
