package com.eyelevel.dispatcher.consumer;

import com.eyelevel.dispatcher.dispatch.DispatchOutcome;
import com.eyelevel.dispatcher.dispatch.Dispatcher;
import com.eyelevel.dispatcher.dto.message.DispatchSignal;
import com.eyelevel.dispatcher.dto.message.ServiceTask;
import com.eyelevel.dispatcher.exception.MessageProcessingFailedException;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Consumes completion, failure and cancellation signals. The signal queue is grouped by submission id,
 * so one submission's signals arrive here one after another.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchSignalConsumer {

    private final Dispatcher dispatcher;

    @SqsListener(value = "${app.dispatch.queues.signal}", factory = "dispatchContainerFactory")
    public void onSignal(@Payload final DispatchSignal signal) {
        if (!isValid(signal)) {
            log.error("[FATAL] Dispatch signal is invalid or incomplete. Message will be dropped. Payload: {}", signal);
            return;
        }

        try {
            final DispatchOutcome outcome = switch (signal.type()) {
                case FINISHED -> dispatcher.serviceFinished(signal.task(), signal.result());
                case FAILED -> dispatcher.serviceFailed(signal.task(), signal.error());
                case CANCEL_TASK -> dispatcher.cancelTask(signal.sid(), signal.sha256(), signal.serviceName());
                case CANCEL_SUBMISSION -> dispatcher.cancelSubmission(signal.sid());
            };
            if (outcome.isIgnored()) {
                log.debug("[{}] {} signal ignored: {}", signal.sid(), signal.type(), outcome);
            } else {
                log.info("[{}] {} signal handled: {}", signal.sid(), signal.type(), outcome);
            }
        } catch (final Exception e) {
            log.error("[{}] Handling {} signal failed. Re-throwing to trigger SQS retry.", signal.sid(),
                      signal.type(), e);
            throw new MessageProcessingFailedException("Signal handling failed for submission " + signal.sid(), e);
        }
    }

    private static boolean isValid(final DispatchSignal signal) {
        if (signal == null || signal.type() == null) {
            return false;
        }
        return switch (signal.type()) {
            case FINISHED, FAILED -> isValidTask(signal.task());
            case CANCEL_TASK -> StringUtils.hasText(signal.sid()) && StringUtils.hasText(signal.sha256()) &&
                                StringUtils.hasText(signal.serviceName());
            case CANCEL_SUBMISSION -> StringUtils.hasText(signal.sid());
        };
    }

    private static boolean isValidTask(final ServiceTask task) {
        return task != null && StringUtils.hasText(task.sid()) && StringUtils.hasText(task.sha256()) &&
               StringUtils.hasText(task.serviceName());
    }
}
