package com.eyelevel.dispatcher.exception;

import java.io.Serial;

/**
 * A base exception for errors raised while scheduling or dispatching a submission.
 */
public class DispatchException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
