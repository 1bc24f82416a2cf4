package com.eyelevel.dispatcher.exception;

import java.io.Serial;

/**
 * Thrown by a queue listener when a submission, signal or archive message could not be applied. The message
 * is left unacknowledged and SQS redelivers it.
 */
public class MessageProcessingFailedException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3546738330082948966L;

    public MessageProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
