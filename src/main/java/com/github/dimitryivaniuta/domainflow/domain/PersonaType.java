package com.github.dimitryivaniuta.domainflow.domain;

/**
 * Persona variant; selects the shape of {@link com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig}.
 */
public enum PersonaType {
    DNS,
    HTTP
}
