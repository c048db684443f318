package com.github.dimitryivaniuta.domainflow.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores a list of integers (ports) as a JSON array.
 */
@Converter
public class IntegerListJsonConverter extends JsonAttributeConverter<List<Integer>> {

    public IntegerListJsonConverter() {
        super(new TypeReference<>() {
        });
    }

    @Override
    protected List<Integer> emptyValue() {
        return new ArrayList<>();
    }
}
