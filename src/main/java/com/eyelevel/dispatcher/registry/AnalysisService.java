package com.eyelevel.dispatcher.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A validated, immutable view of a registered service as used by the scheduler.
 *
 * @param name         unique service name
 * @param category     category the service belongs to
 * @param stage        stage the service runs in, always one of the configured stages
 * @param accepts      compiled accept pattern, {@code null} when the definition has none
 * @param rejects      compiled reject pattern, {@code null} when the definition has none
 * @param failureLimit retries allowed before a task is failed for good
 * @param version      service version, part of the result key
 * @param config       default service parameters
 */
public record AnalysisService(String name, String category, String stage, Pattern accepts, Pattern rejects,
                              int failureLimit, String version, Map<String, Object> config) {

    public AnalysisService {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Tests a file type against the accept and reject patterns. Both are matched against the whole type.
     * A service without an accept pattern accepts nothing.
     */
    public boolean accepts(final String fileType) {
        if (accepts == null || fileType == null) {
            return false;
        }
        if (!accepts.matcher(fileType).matches()) {
            return false;
        }
        return rejects == null || !rejects.matcher(fileType).matches();
    }

    public boolean isInCategory(final String categoryName) {
        return category.equals(categoryName);
    }
}
