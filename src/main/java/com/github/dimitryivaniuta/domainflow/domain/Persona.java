package com.github.dimitryivaniuta.domainflow.domain;

import com.github.dimitryivaniuta.domainflow.domain.converter.PersonaConfigJsonConverter;
import com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Client identity used for DNS or HTTP checks.
 */
@Entity
@Table(
        name = "personas",
        indexes = {
                @Index(name = "idx_personas_type", columnList = "persona_type")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Persona implements PooledResource {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "persona_type", nullable = false, updatable = false, length = 8)
    private PersonaType personaType;

    @Convert(converter = PersonaConfigJsonConverter.class)
    @Column(name = "config_details", nullable = false, columnDefinition = "text")
    private PersonaConfig config;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Embedded
    private ResourceHealth health = new ResourceHealth();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static Persona create(String name, PersonaConfig config) {
        Persona p = new Persona();
        p.id = UUID.randomUUID().toString();
        p.name = name;
        p.personaType = config.personaType();
        p.config = config;
        p.createdAt = Instant.now();
        p.updatedAt = p.createdAt;
        return p;
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PERSONA;
    }
}
