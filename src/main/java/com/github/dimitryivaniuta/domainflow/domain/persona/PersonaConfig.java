package com.github.dimitryivaniuta.domainflow.domain.persona;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.github.dimitryivaniuta.domainflow.domain.PersonaType;

/**
 * Typed persona configuration. The variant must match the persona's {@link PersonaType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DnsPersonaConfig.class, name = "dns"),
        @JsonSubTypes.Type(value = HttpPersonaConfig.class, name = "http")
})
public interface PersonaConfig {

    PersonaType personaType();

    /**
     * Checks the variant's own fields.
     *
     * @return problem description, or null when valid
     */
    String validate();
}
