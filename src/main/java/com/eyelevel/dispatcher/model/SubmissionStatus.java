package com.eyelevel.dispatcher.model;

public enum SubmissionStatus {
    /**
     * At least one file of the submission has not exhausted its schedule.
     */
    INCOMPLETE,
    /**
     * Every file, including extracted ones, is done and no service task is outstanding.
     */
    COMPLETE
}
