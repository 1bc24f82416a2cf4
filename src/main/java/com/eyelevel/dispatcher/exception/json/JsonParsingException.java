package com.eyelevel.dispatcher.exception.json;

import java.io.Serial;

/**
 * Thrown when a service configuration, a JSON column or a canonical config form cannot be read or written.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4315221486898941505L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
