package com.eyelevel.dispatcher.exception;

import java.io.Serial;

public class SubmissionNotFoundException extends DispatchException {
    @Serial
    private static final long serialVersionUID = 7316593140425611890L;

    public SubmissionNotFoundException(String sid) {
        super("Submission not found with ID: " + sid);
    }
}
