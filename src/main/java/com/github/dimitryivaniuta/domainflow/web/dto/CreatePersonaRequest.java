package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request payload for a persona.
 *
 * @param personaType {@code dns} or {@code http}; must match the config variant
 * @param config      typed config, discriminated by its {@code type} property
 */
public record CreatePersonaRequest(
        @NotBlank String name,
        @NotBlank String personaType,
        @NotNull PersonaConfig config
) {}
