package com.eyelevel.dispatcher.dto.message;

public enum SignalType {
    FINISHED,
    FAILED,
    CANCEL_TASK,
    CANCEL_SUBMISSION
}
