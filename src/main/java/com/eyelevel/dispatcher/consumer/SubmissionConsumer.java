package com.eyelevel.dispatcher.consumer;

import com.eyelevel.dispatcher.dispatch.DispatchOutcome;
import com.eyelevel.dispatcher.dispatch.Dispatcher;
import com.eyelevel.dispatcher.dto.message.SubmissionRequest;
import com.eyelevel.dispatcher.exception.MessageProcessingFailedException;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Consumes new submissions and hands them to the {@link Dispatcher}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubmissionConsumer {

    private final Dispatcher dispatcher;

    @SqsListener(value = "${app.dispatch.queues.submission}", factory = "dispatchContainerFactory")
    public void onSubmission(@Payload final SubmissionRequest request) {
        if (request == null || !StringUtils.hasText(request.sid())) {
            log.error("[FATAL] Submission message is invalid or missing 'sid'. Message will be dropped. Payload: {}",
                      request);
            return;
        }

        log.info("[{}] Received submission with {} file(s).", request.sid(),
                 request.files() == null ? 0 : request.files().size());
        try {
            final DispatchOutcome outcome = dispatcher.ingest(request);
            log.info("[{}] Submission ingest outcome: {}", request.sid(), outcome);
        } catch (final Exception e) {
            log.error("[{}] Ingest failed. Re-throwing to trigger SQS retry.", request.sid(), e);
            throw new MessageProcessingFailedException("Ingest failed for submission " + request.sid(), e);
        }
    }
}
