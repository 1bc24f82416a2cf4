package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.model.FileDispatchState;
import com.eyelevel.dispatcher.model.ServiceTaskState;
import com.eyelevel.dispatcher.model.Submission;
import com.eyelevel.dispatcher.model.SubmissionFile;
import com.eyelevel.dispatcher.model.SubmissionStatus;
import com.eyelevel.dispatcher.model.TaskStatus;
import com.eyelevel.dispatcher.repository.ServiceTaskStateRepository;
import com.eyelevel.dispatcher.repository.SubmissionFileRepository;
import com.eyelevel.dispatcher.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides when a submission is complete and writes its summary. Completion is derived from the stored file
 * and task states on every check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionLifecycleManager {

    private final SubmissionRepository submissionRepository;
    private final SubmissionFileRepository submissionFileRepository;
    private final ServiceTaskStateRepository serviceTaskStateRepository;
    private final Clock clock;

    /**
     * Marks the submission complete if every one of its files is done and no task is queued.
     *
     * @return {@code true} if the submission was completed by this call.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean completeIfResolved(final Submission submission) {
        final String sid = submission.getSid();
        if (submission.getStatus() == SubmissionStatus.COMPLETE) {
            return false;
        }
        final long openFiles = submissionFileRepository.countBySubmissionIdAndStateNot(sid, FileDispatchState.DONE);
        if (openFiles > 0) {
            log.debug("[{}] {} file(s) still in progress.", sid, openFiles);
            return false;
        }
        final long queued = serviceTaskStateRepository.countBySubmissionIdAndStatus(sid, TaskStatus.QUEUED);
        if (queued > 0) {
            log.warn("[{}] All files are done but {} task(s) are still queued. Waiting for them.", sid, queued);
            return false;
        }

        final CompletionSummary summary = summarize(serviceTaskStateRepository.findAllBySubmissionId(sid),
                                                    submissionFileRepository.findAllBySubmissionId(sid));
        submission.setStatus(SubmissionStatus.COMPLETE);
        submission.setCompletedAt(LocalDateTime.now(clock));
        submission.setRemark(createRemark(summary));
        submission.setErrorCount(summary.failedCount() + summary.annotatedFileCount());
        submissionRepository.save(submission);
        log.info("[{}] Submission complete. {}", sid, submission.getRemark());
        return true;
    }

    private CompletionSummary summarize(final List<ServiceTaskState> tasks, final List<SubmissionFile> files) {
        int succeeded = 0;
        int cacheHits = 0;
        int failed = 0;
        int cancelled = 0;
        for (ServiceTaskState task : tasks) {
            switch (task.getStatus()) {
                case SUCCEEDED -> succeeded++;
                case CACHE_HIT -> cacheHits++;
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
                default -> {
                }
            }
        }
        final int annotated = (int) files.stream().filter(file -> file.getErrorAnnotation() != null).count();
        return new CompletionSummary(files.size(), succeeded, cacheHits, failed, cancelled, annotated);
    }

    private String createRemark(final CompletionSummary summary) {
        if (summary.fileCount() == 0) {
            return "Submission completed without any file.";
        }
        final List<String> parts = new ArrayList<>();
        if (summary.succeededCount() > 0) {
            parts.add(summary.succeededCount() + " succeeded");
        }
        if (summary.cacheHitCount() > 0) {
            parts.add(summary.cacheHitCount() + " served from cache");
        }
        if (summary.failedCount() > 0) {
            parts.add(summary.failedCount() + " failed");
        }
        if (summary.cancelledCount() > 0) {
            parts.add(summary.cancelledCount() + " cancelled");
        }
        if (summary.annotatedFileCount() > 0) {
            parts.add(summary.annotatedFileCount() + " file(s) not analysed");
        }
        if (parts.isEmpty()) {
            return "Submission completed for " + summary.fileCount() + " file(s) with no service scheduled.";
        }
        return "Summary: " + String.join(", ", parts) + ".";
    }

    private record CompletionSummary(int fileCount, int succeededCount, int cacheHitCount, int failedCount,
                                     int cancelledCount, int annotatedFileCount) {
    }
}
