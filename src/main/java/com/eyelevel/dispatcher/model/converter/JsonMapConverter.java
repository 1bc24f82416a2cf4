package com.eyelevel.dispatcher.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    private static final TypeReference<Map<String, Object>> TYPE = new TypeReference<>() {
    };

    @Override
    protected TypeReference<Map<String, Object>> typeReference() {
        return TYPE;
    }

    @Override
    protected Map<String, Object> emptyValue() {
        return new LinkedHashMap<>();
    }
}
