package com.eyelevel.dispatcher.exception;

import java.io.Serial;

/**
 * Raised by a bounded task group once all of its units have finished and at least one of them failed.
 * The cause is the failure of the first unit, in submission order.
 */
public class TaskGroupException extends DispatchException {
    @Serial
    private static final long serialVersionUID = 1190248336120917451L;

    public TaskGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
