package com.github.dimitryivaniuta.domainflow.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores keyword-set matches as a JSON object: keyword set id to matched patterns.
 */
@Converter
public class KeywordHitsJsonConverter extends JsonAttributeConverter<Map<String, List<String>>> {

    public KeywordHitsJsonConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected Map<String, List<String>> emptyValue() {
        return new LinkedHashMap<>();
    }
}
