package com.eyelevel.dispatcher.common.json;

import java.util.Map;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Used to read the default configuration stored with each service definition.
 */
public interface JsonParser {

    /**
     * Parses a JSON object into a string-keyed map. A blank document yields an empty map.
     *
     * @param json The JSON object as a string, may be {@code null}.
     *
     * @return The parsed map, never {@code null}.
     *
     * @throws com.eyelevel.dispatcher.exception.json.JsonParsingException if the document is not a JSON object.
     */
    Map<String, Object> parseMap(String json);
}
