package com.eyelevel.dispatcher.dispatch;

/**
 * What a dispatcher operation did with its input. Unknown or stale input is reported here rather than thrown.
 */
public enum DispatchOutcome {
    ACCEPTED,
    /**
     * The submission id was already ingested.
     */
    DUPLICATE,
    /**
     * The request lacked the fields needed to act on it.
     */
    INVALID,
    RETRIED,
    TERMINAL_FAILURE,
    CANCELLED,
    /**
     * The (file, service) pair was already resolved, for instance by a redelivered signal.
     */
    IGNORED_DUPLICATE,
    /**
     * No submission or task matches the signal.
     */
    IGNORED_UNKNOWN,
    IGNORED_CANCELLED;

    public boolean isIgnored() {
        return this == IGNORED_DUPLICATE || this == IGNORED_UNKNOWN || this == IGNORED_CANCELLED;
    }
}
