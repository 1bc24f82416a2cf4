package com.eyelevel.dispatcher.common.json.jackson;

import com.eyelevel.dispatcher.common.json.JsonSerializer;
import com.eyelevel.dispatcher.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        try {
            String json = objectMapper.writeValueAsString(object);
            log.trace("Java object has been serialized to JSON: {}", json);
            return json;
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
