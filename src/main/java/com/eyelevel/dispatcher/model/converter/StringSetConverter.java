package com.eyelevel.dispatcher.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

@Converter
public class StringSetConverter extends JsonAttributeConverter<Set<String>> {

    private static final TypeReference<Set<String>> TYPE = new TypeReference<>() {
    };

    @Override
    protected TypeReference<Set<String>> typeReference() {
        return TYPE;
    }

    @Override
    protected Set<String> emptyValue() {
        return new LinkedHashSet<>();
    }
}
