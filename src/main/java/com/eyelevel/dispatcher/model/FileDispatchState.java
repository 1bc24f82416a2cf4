package com.eyelevel.dispatcher.model;

/**
 * Defines the possible states of a file within one submission.
 */
public enum FileDispatchState {
    /**
     * Registered, stage 0 not yet dispatched.
     */
    PENDING,
    /**
     * Waiting for the services of the current stage to resolve.
     */
    AWAITING,
    /**
     * Moving to the next non-empty stage.
     */
    ADVANCING,
    /**
     * The schedule is exhausted or the file could not be scheduled.
     */
    DONE
}
