package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.dto.message.ResultPayload;
import com.eyelevel.dispatcher.dto.message.ServiceTask;
import com.eyelevel.dispatcher.dto.message.SubmissionRequest;
import com.eyelevel.dispatcher.dto.message.SubmittedFile;
import com.eyelevel.dispatcher.exception.DispatchException;
import com.eyelevel.dispatcher.model.AnalysisResult;
import com.eyelevel.dispatcher.model.ExtractedFile;
import com.eyelevel.dispatcher.model.FileDispatchState;
import com.eyelevel.dispatcher.model.FileInfo;
import com.eyelevel.dispatcher.model.ScheduledService;
import com.eyelevel.dispatcher.model.ServiceTaskState;
import com.eyelevel.dispatcher.model.Submission;
import com.eyelevel.dispatcher.model.SubmissionFile;
import com.eyelevel.dispatcher.model.SubmissionStatus;
import com.eyelevel.dispatcher.model.TaskStatus;
import com.eyelevel.dispatcher.registry.AnalysisService;
import com.eyelevel.dispatcher.repository.AnalysisResultRepository;
import com.eyelevel.dispatcher.repository.FileInfoRepository;
import com.eyelevel.dispatcher.repository.ServiceTaskStateRepository;
import com.eyelevel.dispatcher.repository.SubmissionFileRepository;
import com.eyelevel.dispatcher.repository.SubmissionRepository;
import com.eyelevel.dispatcher.scheduling.ConfigHasher;
import com.eyelevel.dispatcher.scheduling.ResultKey;
import com.eyelevel.dispatcher.scheduling.Schedule;
import com.eyelevel.dispatcher.scheduling.Scheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives submissions through their schedules.
 * <p>
 * Each file of a submission moves {@code PENDING -> (AWAITING <-> ADVANCING)* -> DONE}. A stage is closed when
 * no task of that stage is {@link TaskStatus#QUEUED} any more; the file then moves to the next stage that has
 * work, or is done. A submission is complete once every file, extracted ones included, is done.
 * <p>
 * Every public operation runs in its own transaction and takes a row lock on the submission, so signals for one
 * submission are applied one at a time. Tasks reach the service queues only after the transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Dispatcher {

    static final String CANCELLED_ANNOTATION = "cancelled";

    private final SubmissionRepository submissionRepository;
    private final SubmissionFileRepository submissionFileRepository;
    private final ServiceTaskStateRepository serviceTaskStateRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final FileInfoRepository fileInfoRepository;
    private final Scheduler scheduler;
    private final ConfigHasher configHasher;
    private final TaskQueue taskQueue;
    private final RetryBackoffPolicy retryBackoffPolicy;
    private final SubmissionLifecycleManager submissionLifecycleManager;
    private final DispatchConfig dispatchConfig;
    private final Clock clock;

    /**
     * Registers a new submission and dispatches the first stage of each of its files.
     * Ingesting a submission id twice has no effect.
     */
    @Transactional
    public DispatchOutcome ingest(final SubmissionRequest request) {
        if (request == null || !StringUtils.hasText(request.sid())) {
            log.error("Submission request has no id and cannot be ingested: {}", request);
            return DispatchOutcome.INVALID;
        }
        final String sid = request.sid();
        if (submissionRepository.existsById(sid)) {
            log.info("[{}] Submission already ingested. Ignoring the duplicate request.", sid);
            return DispatchOutcome.DUPLICATE;
        }

        final Submission submission = submissionRepository.save(Submission.builder().sid(sid)
                                                .selectedCategories(copyOf(request.selected()))
                                                .excludedCategories(copyOf(request.excluded()))
                                                .serviceParams(request.serviceParams() == null ? new HashMap<>()
                                                                       : new HashMap<>(request.serviceParams()))
                                                .status(SubmissionStatus.INCOMPLETE)
                                                .expiryTs(LocalDateTime.now(clock)
                                                                       .plusDays(dispatchConfig.getSubmissionTtlDays()))
                                                .build());

        final List<SubmittedFile> files = request.files() == null ? List.of() : request.files();
        log.info("[{}] Ingesting submission with {} file(s).", sid, files.size());
        for (SubmittedFile file : files) {
            registerFile(submission, file.sha256(), file.fileType(), null, 0);
        }
        submissionLifecycleManager.completeIfResolved(submission);
        return DispatchOutcome.ACCEPTED;
    }

    /**
     * Records a service's result for a task, schedules any files it extracted and closes the stage when it was
     * the last outstanding task. A signal for a task that is no longer queued is ignored.
     */
    @Transactional
    public DispatchOutcome serviceFinished(final ServiceTask task, final ResultPayload result) {
        final Optional<Submission> found = submissionRepository.findByIdForUpdate(task.sid());
        if (found.isEmpty()) {
            log.warn("[{}] Finished signal from '{}' for an unknown submission. Ignoring.", task.sid(),
                     task.serviceName());
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final Submission submission = found.get();
        final Optional<ServiceTaskState> taskState = findTask(task.sid(), task.sha256(), task.serviceName());
        if (taskState.isEmpty()) {
            log.warn("[{}] Finished signal for unknown task {}/{}. Ignoring.", task.sid(), task.sha256(),
                     task.serviceName());
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final ServiceTaskState state = taskState.get();
        if (!state.getStatus().isOutstanding()) {
            return ignoreResolved(state, "finished");
        }

        state.setStatus(TaskStatus.SUCCEEDED);
        serviceTaskStateRepository.save(state);

        final List<ExtractedFile> extracted = result == null || result.extracted() == null ? List.of()
                                                                                           : result.extracted();
        if (!analysisResultRepository.existsById(state.getResultKey())) {
            analysisResultRepository.save(AnalysisResult.builder().resultKey(state.getResultKey())
                                                        .sha256(task.sha256()).serviceName(task.serviceName())
                                                        .version(task.serviceVersion()).configHash(task.configHash())
                                                        .response(result == null || result.response() == null
                                                                  ? new HashMap<>() : new HashMap<>(result.response()))
                                                        .extractedFiles(new ArrayList<>(extracted))
                                                        .expiryTs(submission.getExpiryTs()).build());
        }
        log.info("[{}] Service '{}' finished file {} with {} extracted file(s).", task.sid(), task.serviceName(),
                 task.sha256(), extracted.size());

        final SubmissionFile file = loadFile(task.sid(), task.sha256());
        registerExtracted(submission, file, extracted);
        closeStageIfResolved(submission, file);
        submissionLifecycleManager.completeIfResolved(submission);
        return DispatchOutcome.ACCEPTED;
    }

    /**
     * Counts a failure of a task. The task is offered again after a backoff while its failure count does not
     * exceed the service's failure limit; past that the pair is failed for good and the stage may close.
     */
    @Transactional
    public DispatchOutcome serviceFailed(final ServiceTask task, final String error) {
        final Optional<Submission> found = submissionRepository.findByIdForUpdate(task.sid());
        if (found.isEmpty()) {
            log.warn("[{}] Failed signal from '{}' for an unknown submission. Ignoring.", task.sid(),
                     task.serviceName());
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final Submission submission = found.get();
        final Optional<ServiceTaskState> taskState = findTask(task.sid(), task.sha256(), task.serviceName());
        if (taskState.isEmpty()) {
            log.warn("[{}] Failed signal for unknown task {}/{}. Ignoring.", task.sid(), task.sha256(),
                     task.serviceName());
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final ServiceTaskState state = taskState.get();
        if (!state.getStatus().isOutstanding()) {
            return ignoreResolved(state, "failed");
        }
        if (task.attempt() > 0 && task.attempt() <= state.getFailureCount()) {
            log.debug("[{}] Failure of attempt {} of '{}' on {} was already counted. Ignoring.", task.sid(),
                      task.attempt(), task.serviceName(), task.sha256());
            return DispatchOutcome.IGNORED_DUPLICATE;
        }

        state.setFailureCount(state.getFailureCount() + 1);
        state.setLastError(error);
        if (state.getFailureCount() <= state.getFailureLimit()) {
            serviceTaskStateRepository.save(state);
            final Duration delay = retryBackoffPolicy.delayFor(state.getFailureCount());
            taskQueue.push(task.withAttempt(state.getFailureCount() + 1), delay);
            log.warn("[{}] Service '{}' failed on file {} ({}/{}). Retrying in {} ms. Error: {}", task.sid(),
                     task.serviceName(), task.sha256(), state.getFailureCount(), state.getFailureLimit(),
                     delay.toMillis(), error);
            return DispatchOutcome.RETRIED;
        }

        state.setStatus(TaskStatus.FAILED);
        serviceTaskStateRepository.save(state);
        log.error("[{}] Service '{}' failed on file {} after {} attempts. Giving up. Last error: {}", task.sid(),
                  task.serviceName(), task.sha256(), state.getFailureCount(), error);

        closeStageIfResolved(submission, loadFile(task.sid(), task.sha256()));
        submissionLifecycleManager.completeIfResolved(submission);
        return DispatchOutcome.TERMINAL_FAILURE;
    }

    /**
     * Withdraws one queued task. The service's later signal for it is ignored.
     */
    @Transactional
    public DispatchOutcome cancelTask(final String sid, final String sha256, final String serviceName) {
        final Optional<Submission> found = submissionRepository.findByIdForUpdate(sid);
        final Optional<ServiceTaskState> taskState = found.isEmpty() ? Optional.empty()
                                                                     : findTask(sid, sha256, serviceName);
        if (taskState.isEmpty()) {
            log.warn("[{}] Cannot cancel unknown task {}/{}.", sid, sha256, serviceName);
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final ServiceTaskState state = taskState.get();
        if (!state.getStatus().isOutstanding()) {
            return ignoreResolved(state, "cancel");
        }
        state.setStatus(TaskStatus.CANCELLED);
        serviceTaskStateRepository.save(state);
        log.info("[{}] Cancelled task of '{}' on file {}.", sid, serviceName, sha256);

        final Submission submission = found.get();
        closeStageIfResolved(submission, loadFile(sid, sha256));
        submissionLifecycleManager.completeIfResolved(submission);
        return DispatchOutcome.CANCELLED;
    }

    /**
     * Withdraws every queued task of a submission and closes its open files, which completes the submission.
     */
    @Transactional
    public DispatchOutcome cancelSubmission(final String sid) {
        final Optional<Submission> found = submissionRepository.findByIdForUpdate(sid);
        if (found.isEmpty()) {
            log.warn("[{}] Cannot cancel unknown submission.", sid);
            return DispatchOutcome.IGNORED_UNKNOWN;
        }
        final Submission submission = found.get();
        if (submission.getStatus() == SubmissionStatus.COMPLETE) {
            log.info("[{}] Submission is already complete. Nothing to cancel.", sid);
            return DispatchOutcome.IGNORED_DUPLICATE;
        }

        final List<ServiceTaskState> queued = serviceTaskStateRepository.findAllBySubmissionIdAndStatus(sid,
                                                                                                         TaskStatus.QUEUED);
        queued.forEach(state -> state.setStatus(TaskStatus.CANCELLED));
        serviceTaskStateRepository.saveAll(queued);

        final List<SubmissionFile> open = submissionFileRepository.findAllBySubmissionId(sid).stream()
                                                                  .filter(file -> file.getState() !=
                                                                                  FileDispatchState.DONE)
                                                                  .toList();
        open.forEach(file -> {
            file.setState(FileDispatchState.DONE);
            file.setErrorAnnotation(CANCELLED_ANNOTATION);
        });
        submissionFileRepository.saveAll(open);
        log.info("[{}] Cancelled submission: {} task(s) withdrawn, {} file(s) closed.", sid, queued.size(),
                 open.size());

        submissionLifecycleManager.completeIfResolved(submission);
        return DispatchOutcome.CANCELLED;
    }

    private void registerExtracted(final Submission submission, final SubmissionFile parent,
                                   final List<ExtractedFile> extracted) {
        for (ExtractedFile child : extracted) {
            registerFile(submission, child.sha256(), child.fileType(), parent.getSha256(), parent.getDepth() + 1);
        }
    }

    /**
     * Adds a file to the submission and dispatches its first stage with work. A file that cannot be scheduled is
     * stored as done with an annotation explaining why.
     */
    private void registerFile(final Submission submission, final String sha256, final String fileType,
                              final String parentSha256, final int depth) {
        final String sid = submission.getSid();
        if (!StringUtils.hasText(sha256)) {
            log.error("[{}] Dropping a file without sha256 (parent {}).", sid, parentSha256);
            return;
        }
        if (submissionFileRepository.existsBySubmissionIdAndSha256(sid, sha256)) {
            log.debug("[{}] File {} is already part of the submission.", sid, sha256);
            return;
        }

        final SubmissionFile file = SubmissionFile.builder().submissionId(sid).sha256(sha256).fileType(fileType)
                                                  .parentSha256(parentSha256).depth(depth)
                                                  .state(FileDispatchState.PENDING).stageIndex(-1)
                                                  .expiryTs(submission.getExpiryTs()).build();
        recordFileInfo(sha256, fileType, submission.getExpiryTs());

        String annotation = null;
        if (!StringUtils.hasText(fileType)) {
            annotation = "file type could not be determined";
        } else if (depth > dispatchConfig.getMaxExtractionDepth()) {
            annotation = "extraction depth %d exceeds the limit of %d".formatted(depth,
                                                                                 dispatchConfig.getMaxExtractionDepth());
        } else if (submissionFileRepository.countBySubmissionId(sid) >= dispatchConfig.getMaxFilesPerSubmission()) {
            annotation = "submission already holds the maximum of %d files".formatted(
                    dispatchConfig.getMaxFilesPerSubmission());
        } else {
            try {
                file.setSchedule(snapshot(submission, scheduler.buildSchedule(submission, fileType)));
            } catch (DispatchException e) {
                annotation = "scheduling failed: " + e.getMessage();
            }
        }

        if (annotation != null) {
            file.setState(FileDispatchState.DONE);
            file.setErrorAnnotation(annotation);
            submissionFileRepository.save(file);
            log.warn("[{}] File {} will not be analysed: {}", sid, sha256, annotation);
            return;
        }

        submissionFileRepository.save(file);
        log.info("[{}] Registered file {} of type '{}' at depth {}.", sid, sha256, fileType, depth);
        advance(submission, file, 0);
    }

    private void recordFileInfo(final String sha256, final String fileType, final LocalDateTime expiryTs) {
        final FileInfo info = fileInfoRepository.findById(sha256)
                                                .orElseGet(() -> FileInfo.builder().sha256(sha256).fileType(fileType)
                                                                         .build());
        if (!info.isArchived() && (info.getExpiryTs() == null || info.getExpiryTs().isBefore(expiryTs))) {
            info.setExpiryTs(expiryTs);
        }
        fileInfoRepository.save(info);
    }

    private void extendExpiry(final AnalysisResult result, final LocalDateTime expiryTs) {
        if (result.isArchived() || expiryTs == null) {
            return;
        }
        if (result.getExpiryTs() == null || result.getExpiryTs().isBefore(expiryTs)) {
            result.setExpiryTs(expiryTs);
            analysisResultRepository.save(result);
        }
    }

    /**
     * Freezes a schedule into the file's record, resolving each service's effective configuration.
     */
    private List<List<ScheduledService>> snapshot(final Submission submission, final Schedule schedule) {
        final List<List<ScheduledService>> stages = new ArrayList<>(schedule.size());
        for (Map<String, AnalysisService> bucket : schedule.buckets()) {
            final List<ScheduledService> services = new ArrayList<>(bucket.size());
            for (AnalysisService service : bucket.values()) {
                final Map<String, Object> config = configHasher.effectiveConfig(
                        service.config(), submission.getServiceParams().get(service.name()));
                services.add(new ScheduledService(service.name(), service.version(), service.failureLimit(),
                                                  configHasher.hash(config), config));
            }
            stages.add(services);
        }
        return stages;
    }

    /**
     * Dispatches stages starting at {@code fromStage} until one leaves queued work; the file is done when none does.
     */
    private void advance(final Submission submission, final SubmissionFile file, final int fromStage) {
        file.setState(FileDispatchState.ADVANCING);
        final List<List<ScheduledService>> schedule = file.getSchedule();
        for (int stage = fromStage; stage < schedule.size(); stage++) {
            file.setStageIndex(stage);
            if (dispatchStage(submission, file, stage, schedule.get(stage)) > 0) {
                file.setState(FileDispatchState.AWAITING);
                submissionFileRepository.save(file);
                return;
            }
        }
        file.setState(FileDispatchState.DONE);
        submissionFileRepository.save(file);
        log.info("[{}] File {} has completed its schedule.", submission.getSid(), file.getSha256());
    }

    /**
     * @return The number of tasks of this stage left queued. Cached results resolve their service immediately.
     */
    private int dispatchStage(final Submission submission, final SubmissionFile file, final int stageIndex,
                              final List<ScheduledService> services) {
        final String sid = submission.getSid();
        int queued = 0;
        for (ScheduledService service : services) {
            final Optional<ServiceTaskState> existing = findTask(sid, file.getSha256(), service.name());
            if (existing.isPresent()) {
                if (existing.get().getStatus() == TaskStatus.QUEUED) {
                    queued++;
                }
                continue;
            }

            final String resultKey = new ResultKey(file.getSha256(), service.name(), service.version(),
                                                   service.configHash()).toString();
            final ServiceTaskState state = ServiceTaskState.builder().submissionId(sid).sha256(file.getSha256())
                                                           .serviceName(service.name()).stageIndex(stageIndex)
                                                           .failureLimit(service.failureLimit()).resultKey(resultKey)
                                                           .expiryTs(submission.getExpiryTs()).build();

            final Optional<AnalysisResult> cached = analysisResultRepository.findById(resultKey);
            if (cached.isPresent()) {
                state.setStatus(TaskStatus.CACHE_HIT);
                serviceTaskStateRepository.save(state);
                log.info("[{}] Reusing cached result of '{}' for file {}.", sid, service.name(), file.getSha256());
                extendExpiry(cached.get(), submission.getExpiryTs());
                registerExtracted(submission, file, cached.get().getExtractedFiles());
                continue;
            }

            state.setStatus(TaskStatus.QUEUED);
            serviceTaskStateRepository.save(state);
            taskQueue.push(new ServiceTask(sid, file.getSha256(), file.getFileType(), service.name(),
                                           service.version(), service.configHash(), service.config(), 1),
                           Duration.ZERO);
            queued++;
        }
        return queued;
    }

    private void closeStageIfResolved(final Submission submission, final SubmissionFile file) {
        if (file.getState() != FileDispatchState.AWAITING) {
            return;
        }
        final long outstanding = serviceTaskStateRepository.countBySubmissionIdAndSha256AndStageIndexAndStatus(
                submission.getSid(), file.getSha256(), file.getStageIndex(), TaskStatus.QUEUED);
        if (outstanding > 0) {
            log.debug("[{}] Stage {} of file {} still has {} task(s) outstanding.", submission.getSid(),
                      file.getStageIndex(), file.getSha256(), outstanding);
            return;
        }
        advance(submission, file, file.getStageIndex() + 1);
    }

    private DispatchOutcome ignoreResolved(final ServiceTaskState state, final String signal) {
        log.debug("[{}] Ignoring '{}' signal for '{}' on file {}: task is already {}.", state.getSubmissionId(),
                  signal, state.getServiceName(), state.getSha256(), state.getStatus());
        return state.getStatus() == TaskStatus.CANCELLED ? DispatchOutcome.IGNORED_CANCELLED
                                                         : DispatchOutcome.IGNORED_DUPLICATE;
    }

    private Optional<ServiceTaskState> findTask(final String sid, final String sha256, final String serviceName) {
        return serviceTaskStateRepository.findBySubmissionIdAndSha256AndServiceName(sid, sha256, serviceName);
    }

    private SubmissionFile loadFile(final String sid, final String sha256) {
        return submissionFileRepository.findBySubmissionIdAndSha256(sid, sha256).orElseThrow(
                () -> new DispatchException("[%s] Task state exists for file %s but the file does not".formatted(sid,
                                                                                                                sha256)));
    }

    private static LinkedHashSet<String> copyOf(final Collection<String> values) {
        return values == null ? new LinkedHashSet<>() : new LinkedHashSet<>(values);
    }
}
