package com.eyelevel.dispatcher.dto.message;

/**
 * Message on the signal queue. Service workers send {@link SignalType#FINISHED} and {@link SignalType#FAILED}
 * with the task they were given; cancellation signals only name the submission, and for a single task the
 * file and service.
 */
public record DispatchSignal(SignalType type, ServiceTask task, ResultPayload result, String error, String sid,
                             String sha256, String serviceName) {

    public static DispatchSignal finished(final ServiceTask task, final ResultPayload result) {
        return new DispatchSignal(SignalType.FINISHED, task, result, null, task.sid(), task.sha256(),
                                  task.serviceName());
    }

    public static DispatchSignal failed(final ServiceTask task, final String error) {
        return new DispatchSignal(SignalType.FAILED, task, null, error, task.sid(), task.sha256(), task.serviceName());
    }

    public static DispatchSignal cancelTask(final String sid, final String sha256, final String serviceName) {
        return new DispatchSignal(SignalType.CANCEL_TASK, null, null, null, sid, sha256, serviceName);
    }

    public static DispatchSignal cancelSubmission(final String sid) {
        return new DispatchSignal(SignalType.CANCEL_SUBMISSION, null, null, null, sid, null, null);
    }
}
