package com.github.dimitryivaniuta.domainflow.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores a list of strings (ids, keywords, addresses) as a JSON array.
 */
@Converter
public class StringListJsonConverter extends JsonAttributeConverter<List<String>> {

    public StringListJsonConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
