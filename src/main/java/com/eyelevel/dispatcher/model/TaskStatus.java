package com.eyelevel.dispatcher.model;

/**
 * Defines the possible states of one (file, service) pair within one submission.
 */
public enum TaskStatus {
    /**
     * The task is on the service queue and counts as outstanding work for its stage.
     */
    QUEUED,
    SUCCEEDED,
    /**
     * A result already existed under the task's result key, so the service was never invoked.
     */
    CACHE_HIT,
    /**
     * The service failed more often than its failure limit allows.
     */
    FAILED,
    CANCELLED;

    public boolean isOutstanding() {
        return this == QUEUED;
    }
}
