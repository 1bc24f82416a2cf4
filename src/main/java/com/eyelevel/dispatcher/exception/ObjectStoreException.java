package com.eyelevel.dispatcher.exception;

import java.io.Serial;

/**
 * Thrown when a blob cannot be transferred to or from an object store.
 */
public class ObjectStoreException extends DispatchException {
    @Serial
    private static final long serialVersionUID = -6069478129405738144L;

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
