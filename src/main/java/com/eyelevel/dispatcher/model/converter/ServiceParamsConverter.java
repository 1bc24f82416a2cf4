package com.eyelevel.dispatcher.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-service parameter overrides, keyed by service name.
 */
@Converter
public class ServiceParamsConverter extends JsonAttributeConverter<Map<String, Map<String, Object>>> {

    private static final TypeReference<Map<String, Map<String, Object>>> TYPE = new TypeReference<>() {
    };

    @Override
    protected TypeReference<Map<String, Map<String, Object>>> typeReference() {
        return TYPE;
    }

    @Override
    protected Map<String, Map<String, Object>> emptyValue() {
        return new LinkedHashMap<>();
    }
}
