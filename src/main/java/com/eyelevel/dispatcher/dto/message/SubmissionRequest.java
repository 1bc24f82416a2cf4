package com.eyelevel.dispatcher.dto.message;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Message on the submission queue asking for a new bundle of files to be analysed.
 *
 * @param sid           submission id chosen by the caller, ingest is idempotent on it
 * @param selected      category or service names to run, empty for all services
 * @param excluded      category or service names to leave out
 * @param serviceParams per-service parameter overrides, keyed by service name
 * @param files         the declared files
 */
public record SubmissionRequest(String sid, Set<String> selected, Set<String> excluded,
                                Map<String, Map<String, Object>> serviceParams, List<SubmittedFile> files) {
}
