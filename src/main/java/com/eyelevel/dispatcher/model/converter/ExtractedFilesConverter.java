package com.eyelevel.dispatcher.model.converter;

import com.eyelevel.dispatcher.model.ExtractedFile;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class ExtractedFilesConverter extends JsonAttributeConverter<List<ExtractedFile>> {

    private static final TypeReference<List<ExtractedFile>> TYPE = new TypeReference<>() {
    };

    @Override
    protected TypeReference<List<ExtractedFile>> typeReference() {
        return TYPE;
    }

    @Override
    protected List<ExtractedFile> emptyValue() {
        return new ArrayList<>();
    }
}
