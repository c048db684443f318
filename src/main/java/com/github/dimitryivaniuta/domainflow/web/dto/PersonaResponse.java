package com.github.dimitryivaniuta.domainflow.web.dto;

import com.github.dimitryivaniuta.domainflow.domain.Persona;
import com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig;

public record PersonaResponse(
        String personaId,
        String name,
        String personaType,
        PersonaConfig config,
        boolean enabled,
        HealthResponse health
) {
    public static PersonaResponse from(Persona p) {
        return new PersonaResponse(p.getId(), p.getName(), p.getPersonaType().name(), p.getConfig(), p.isEnabled(),
                HealthResponse.from(p.getHealth()));
    }
}
