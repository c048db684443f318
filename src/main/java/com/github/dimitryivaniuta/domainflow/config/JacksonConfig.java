package com.github.dimitryivaniuta.domainflow.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Jackson configuration.
 *
 * <p>The "canonical" mapper sorts properties and map keys so that equal values always serialise to
 * the same bytes. Generation fingerprints are hashed from its output.</p>
 */
@Configuration
public class JacksonConfig {

    /**
     * Canonical ObjectMapper used for fingerprinting and cache values.
     *
     * @param builder Boot's mapper builder
     * @return canonical mapper
     */
    @Bean("canonicalObjectMapper")
    public ObjectMapper canonicalObjectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper om = builder.createXmlMapper(false).build();
        om.registerModule(new JavaTimeModule());
        om.configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true);
        om.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return om;
    }

    @Bean
    Jackson2ObjectMapperBuilderCustomizer javaTimeModule() {
        return builder -> builder.modules(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
