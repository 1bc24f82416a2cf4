package com.eyelevel.dispatcher.model.converter;

import com.eyelevel.dispatcher.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Stores a structured attribute as a JSON text column.
 *
 * @param <T> the attribute type
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected abstract TypeReference<T> typeReference();

    /**
     * @return The value used when the column is {@code null}.
     */
    protected abstract T emptyValue();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Failed to write attribute as JSON", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }
        try {
            return OBJECT_MAPPER.readValue(dbData, typeReference());
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Failed to read JSON column", e);
        }
    }
}
