package com.eyelevel.dispatcher.dto.message;

import java.util.Map;

/**
 * One file assigned to one service within one submission, as placed on the service's queue.
 *
 * @param attempt 1 for the first delivery, incremented on each retry
 */
public record ServiceTask(String sid, String sha256, String fileType, String serviceName, String serviceVersion,
                          String configHash, Map<String, Object> config, int attempt) {

    public ServiceTask withAttempt(final int nextAttempt) {
        return new ServiceTask(sid, sha256, fileType, serviceName, serviceVersion, configHash, config, nextAttempt);
    }
}
