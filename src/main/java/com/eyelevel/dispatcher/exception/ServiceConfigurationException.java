package com.eyelevel.dispatcher.exception;

import java.io.Serial;

/**
 * Thrown when a service definition cannot be loaded into the registry, for example because it names
 * a stage that is not part of the configured stage list or carries an invalid file-type pattern.
 */
public class ServiceConfigurationException extends DispatchException {
    @Serial
    private static final long serialVersionUID = -2214897520318450221L;

    public ServiceConfigurationException(String message) {
        super(message);
    }

    public ServiceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
