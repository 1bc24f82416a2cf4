package com.eyelevel.dispatcher.model;

import java.util.Map;

/**
 * The part of a service definition captured in a file's schedule when the file is registered.
 * Later registry changes do not affect files that are already in flight.
 *
 * @param name         service name
 * @param version      service version, part of the result key
 * @param failureLimit retries allowed before the task is failed for good
 * @param configHash   hash of the effective configuration
 * @param config       effective configuration handed to the service
 */
public record ScheduledService(String name, String version, int failureLimit, String configHash,
                               Map<String, Object> config) {
}
