package com.eyelevel.dispatcher.model.converter;

import com.eyelevel.dispatcher.model.ScheduledService;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * A file's schedule snapshot: one list of services per stage, in stage order.
 */
@Converter
public class ScheduleConverter extends JsonAttributeConverter<List<List<ScheduledService>>> {

    private static final TypeReference<List<List<ScheduledService>>> TYPE = new TypeReference<>() {
    };

    @Override
    protected TypeReference<List<List<ScheduledService>>> typeReference() {
        return TYPE;
    }

    @Override
    protected List<List<ScheduledService>> emptyValue() {
        return new ArrayList<>();
    }
}
