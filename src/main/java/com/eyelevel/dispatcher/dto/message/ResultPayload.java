package com.eyelevel.dispatcher.dto.message;

import com.eyelevel.dispatcher.model.ExtractedFile;

import java.util.List;
import java.util.Map;

/**
 * What a service reports back on success.
 *
 * @param response  the service's result body
 * @param extracted files produced while analysing the task's file, to be scheduled in the same submission
 */
public record ResultPayload(Map<String, Object> response, List<ExtractedFile> extracted) {
}
