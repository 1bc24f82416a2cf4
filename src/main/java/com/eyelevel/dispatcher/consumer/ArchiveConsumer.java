package com.eyelevel.dispatcher.consumer;

import com.eyelevel.dispatcher.dto.message.ArchiveRequest;
import com.eyelevel.dispatcher.exception.MessageProcessingFailedException;
import com.eyelevel.dispatcher.exception.SubmissionNotFoundException;
import com.eyelevel.dispatcher.service.archive.ArchiveReport;
import com.eyelevel.dispatcher.service.archive.SubmissionArchiver;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveConsumer {

    private final SubmissionArchiver submissionArchiver;

    @SqsListener(value = "${app.dispatch.queues.archive}", factory = "dispatchContainerFactory")
    public void onArchiveRequest(@Payload final ArchiveRequest request) {
        if (request == null || !StringUtils.hasText(request.id())) {
            log.error("[FATAL] Archive message is invalid or missing 'id'. Message will be dropped. Payload: {}",
                      request);
            return;
        }
        if (!SubmissionArchiver.SUBMISSION_TYPE.equals(request.archiveType())) {
            log.error("[FATAL] Unsupported archive type '{}' for id {}. Message will be dropped.",
                      request.archiveType(), request.id());
            return;
        }

        try {
            final ArchiveReport report = submissionArchiver.archive(request.id(), request.deleteAfter());
            log.info("[{}] Archived submission: {}", request.id(), report);
        } catch (final SubmissionNotFoundException e) {
            log.warn("[{}] Submission to archive does not exist. Message will be dropped.", request.id());
        } catch (final Exception e) {
            log.error("[{}] Archiving failed. Re-throwing to trigger SQS retry.", request.id(), e);
            throw new MessageProcessingFailedException("Archiving failed for submission " + request.id(), e);
        }
    }
}
