package com.github.dimitryivaniuta.domainflow.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.domainflow.domain.persona.PersonaConfig;
import jakarta.persistence.Converter;

/**
 * Stores the persona config variant; the {@code type} discriminator selects DNS or HTTP on read.
 */
@Converter
public class PersonaConfigJsonConverter extends JsonAttributeConverter<PersonaConfig> {

    public PersonaConfigJsonConverter() {
        super(new TypeReference<>() {
        });
    }
}
