package com.eyelevel.dispatcher.dispatch;

import com.eyelevel.dispatcher.common.json.jackson.JacksonJsonParser;
import com.eyelevel.dispatcher.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.dispatcher.dto.message.ResultPayload;
import com.eyelevel.dispatcher.dto.message.ServiceTask;
import com.eyelevel.dispatcher.dto.message.SubmissionRequest;
import com.eyelevel.dispatcher.dto.message.SubmittedFile;
import com.eyelevel.dispatcher.model.ExtractedFile;
import com.eyelevel.dispatcher.model.FileDispatchState;
import com.eyelevel.dispatcher.model.ServiceDefinition;
import com.eyelevel.dispatcher.model.ServiceTaskState;
import com.eyelevel.dispatcher.model.Submission;
import com.eyelevel.dispatcher.model.SubmissionFile;
import com.eyelevel.dispatcher.model.SubmissionStatus;
import com.eyelevel.dispatcher.model.TaskStatus;
import com.eyelevel.dispatcher.registry.ServiceRegistry;
import com.eyelevel.dispatcher.repository.AnalysisResultRepository;
import com.eyelevel.dispatcher.repository.FileInfoRepository;
import com.eyelevel.dispatcher.repository.ServiceTaskStateRepository;
import com.eyelevel.dispatcher.repository.SubmissionFileRepository;
import com.eyelevel.dispatcher.repository.SubmissionRepository;
import com.eyelevel.dispatcher.scheduling.ConfigHasher;
import com.eyelevel.dispatcher.scheduling.Scheduler;
import com.eyelevel.dispatcher.support.InMemoryTaskQueue;
import com.eyelevel.dispatcher.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({Dispatcher.class, SubmissionLifecycleManager.class, Scheduler.class, ServiceRegistry.class,
        ConfigHasher.class, RetryBackoffPolicy.class, JacksonJsonParser.class, JacksonJsonSerializer.class,
        DispatcherTest.TestConfig.class})
class DispatcherTest {

    private static final String TEXT = "text/plain";
    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @TestConfiguration
    static class TestConfig {

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean
        InMemoryTaskQueue taskQueue() {
            return new InMemoryTaskQueue();
        }
    }

    @Autowired
    private Dispatcher dispatcher;
    @Autowired
    private ServiceRegistry serviceRegistry;
    @Autowired
    private InMemoryTaskQueue taskQueue;
    @Autowired
    private MutableClock clock;
    @Autowired
    private SubmissionRepository submissionRepository;
    @Autowired
    private SubmissionFileRepository submissionFileRepository;
    @Autowired
    private ServiceTaskStateRepository serviceTaskStateRepository;
    @Autowired
    private AnalysisResultRepository analysisResultRepository;
    @Autowired
    private FileInfoRepository fileInfoRepository;

    @BeforeEach
    void setUp() {
        taskQueue.clear();
        clock.set(START);
        register("X", "static", "pre", 5);
        register("Y", "system", "post", 5);
    }

    @Test
    void ingest_runsStagesInOrderAndCompletesAfterTheLastService() {
        // Given
        assertThat(ingest("s1", Set.of(), Set.of(), file("f1"))).isEqualTo(DispatchOutcome.ACCEPTED);

        // Then only the first stage is dispatched
        assertThat(taskQueue.size("X")).isEqualTo(1);
        assertThat(taskQueue.size("Y")).isZero();
        SubmissionFile file = fileOf("s1", "f1");
        assertThat(file.getState()).isEqualTo(FileDispatchState.AWAITING);
        assertThat(file.getStageIndex()).isZero();

        // When X finishes, Y is dispatched
        assertThat(finish(pop("X"))).isEqualTo(DispatchOutcome.ACCEPTED);
        assertThat(taskQueue.size("Y")).isEqualTo(1);
        assertThat(fileOf("s1", "f1").getStageIndex()).isEqualTo(2);
        assertThat(status("s1")).isEqualTo(SubmissionStatus.INCOMPLETE);

        // When Y finishes, the submission is complete
        finish(pop("Y"));
        assertThat(fileOf("s1", "f1").getState()).isEqualTo(FileDispatchState.DONE);
        Submission submission = submissionRepository.findById("s1").orElseThrow();
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(submission.getCompletedAt()).isNotNull();
        assertThat(submission.getRemark()).isEqualTo("Summary: 2 succeeded.");
        assertThat(submission.getErrorCount()).isZero();
        assertThat(analysisResultRepository.count()).isEqualTo(2);
        assertThat(fileInfoRepository.findById("f1")).isPresent();
    }

    @Test
    void ingest_isIdempotentOnSubmissionId() {
        ingest("s1", Set.of(), Set.of(), file("f1"));

        assertThat(ingest("s1", Set.of(), Set.of(), file("f1"))).isEqualTo(DispatchOutcome.DUPLICATE);
        assertThat(taskQueue.size("X")).isEqualTo(1);
    }

    @Test
    void ingest_rejectsRequestWithoutId() {
        assertThat(dispatcher.ingest(new SubmissionRequest(" ", null, null, null, null)))
                .isEqualTo(DispatchOutcome.INVALID);
    }

    @Test
    void ingest_withoutFilesCompletesImmediately() {
        ingest("empty", Set.of(), Set.of());

        assertThat(status("empty")).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(submissionRepository.findById("empty").orElseThrow().getRemark())
                .isEqualTo("Submission completed without any file.");
    }

    @Test
    void serviceFailed_retriesUpToTheFailureLimitThenGivesUp() {
        // Given
        register("Z", "flaky", "core", 2);
        ingest("s2", Set.of("Z"), Set.of(), file("f2"));
        ServiceTask first = pop("Z");

        // When
        DispatchOutcome firstFailure = dispatcher.serviceFailed(first, "timeout");
        DispatchOutcome secondFailure = dispatcher.serviceFailed(pop("Z"), "timeout");
        DispatchOutcome thirdFailure = dispatcher.serviceFailed(pop("Z"), "crash");

        // Then
        assertThat(firstFailure).isEqualTo(DispatchOutcome.RETRIED);
        assertThat(secondFailure).isEqualTo(DispatchOutcome.RETRIED);
        assertThat(thirdFailure).isEqualTo(DispatchOutcome.TERMINAL_FAILURE);

        List<InMemoryTaskQueue.Push> retries = taskQueue.pushes().stream()
                                                        .filter(push -> push.task().serviceName().equals("Z"))
                                                        .filter(push -> push.task().attempt() > 1).toList();
        assertThat(retries).hasSize(2);
        assertThat(retries).allSatisfy(push -> assertThat(push.delay()).isPositive());
        assertThat(taskQueue.size("Z")).isZero();

        ServiceTaskState state = taskState("s2", "f2", "Z");
        assertThat(state.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(state.getFailureCount()).isEqualTo(3);
        assertThat(state.getLastError()).isEqualTo("crash");

        // The stage closed without Z, Y (system) is next
        assertThat(taskQueue.size("Y")).isEqualTo(1);
        finish(pop("Y"));
        Submission submission = submissionRepository.findById("s2").orElseThrow();
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(submission.getErrorCount()).isEqualTo(1);
        assertThat(submission.getRemark()).contains("1 failed");
    }

    @Test
    void serviceFailed_ignoresARedeliveredFailureOfTheSameAttempt() {
        register("Z", "flaky", "core", 2);
        ingest("s1", Set.of("Z"), Set.of(), file("f1"));
        ServiceTask task = pop("Z");

        assertThat(dispatcher.serviceFailed(task, "timeout")).isEqualTo(DispatchOutcome.RETRIED);
        assertThat(dispatcher.serviceFailed(task, "timeout")).isEqualTo(DispatchOutcome.IGNORED_DUPLICATE);
        assertThat(taskState("s1", "f1", "Z").getFailureCount()).isEqualTo(1);
    }

    @Test
    void serviceFinished_schedulesExtractedFilesBeforeCompleting() {
        // Given
        ingest("s1", Set.of(), Set.of(), file("f1"));

        // When X extracts F2
        finish(pop("X"), new ExtractedFile("f2", TEXT, "dropped.txt"));

        // Then F2 is registered and scheduled on its own
        SubmissionFile child = fileOf("s1", "f2");
        assertThat(child.getParentSha256()).isEqualTo("f1");
        assertThat(child.getDepth()).isEqualTo(1);
        assertThat(child.getState()).isEqualTo(FileDispatchState.AWAITING);
        assertThat(taskQueue.size("X")).isEqualTo(1);

        finish(pop("Y"));
        assertThat(fileOf("s1", "f1").getState()).isEqualTo(FileDispatchState.DONE);
        assertThat(status("s1")).isEqualTo(SubmissionStatus.INCOMPLETE);

        finish(pop("X"));
        finish(pop("Y"));
        assertThat(fileOf("s1", "f2").getState()).isEqualTo(FileDispatchState.DONE);
        assertThat(status("s1")).isEqualTo(SubmissionStatus.COMPLETE);
    }

    @Test
    void serviceFinished_redeliveryIsANoOp() {
        ingest("s1", Set.of(), Set.of(), file("f1"));
        ServiceTask task = pop("X");
        ResultPayload payload = new ResultPayload(Map.of("score", 10), List.of(new ExtractedFile("f2", TEXT, "a")));

        assertThat(dispatcher.serviceFinished(task, payload)).isEqualTo(DispatchOutcome.ACCEPTED);
        long files = submissionFileRepository.countBySubmissionId("s1");
        long results = analysisResultRepository.count();
        int queued = taskQueue.totalSize();

        assertThat(dispatcher.serviceFinished(task, payload)).isEqualTo(DispatchOutcome.IGNORED_DUPLICATE);
        assertThat(submissionFileRepository.countBySubmissionId("s1")).isEqualTo(files);
        assertThat(analysisResultRepository.count()).isEqualTo(results);
        assertThat(taskQueue.totalSize()).isEqualTo(queued);
    }

    @Test
    void serviceFinished_ignoresUnknownTasks() {
        ServiceTask stray = new ServiceTask("nope", "f1", TEXT, "X", "0", "h", Map.of(), 1);

        assertThat(dispatcher.serviceFinished(stray, null)).isEqualTo(DispatchOutcome.IGNORED_UNKNOWN);
    }

    @Test
    void advance_skipsEmptyStagesWithoutEmittingTasks() {
        ingest("s1", Set.of("system"), Set.of(), file("f1"));

        assertThat(taskQueue.pushes()).hasSize(1);
        assertThat(taskQueue.size("Y")).isEqualTo(1);
        assertThat(fileOf("s1", "f1").getStageIndex()).isEqualTo(2);
        assertThat(serviceTaskStateRepository.findAllBySubmissionId("s1")).hasSize(1);
    }

    @Test
    void dispatch_reusesCachedResultsForIdenticalConfiguration() {
        // Given a first submission that ran both services on f1
        ingest("s1", Set.of(), Set.of(), file("f1"));
        finish(pop("X"));
        finish(pop("Y"));
        taskQueue.clear();

        // When the same file is submitted again
        ingest("s2", Set.of(), Set.of(), file("f1"));

        // Then no task is emitted and the submission completes from cache
        assertThat(taskQueue.pushes()).isEmpty();
        assertThat(taskState("s2", "f1", "X").getStatus()).isEqualTo(TaskStatus.CACHE_HIT);
        assertThat(status("s2")).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(submissionRepository.findById("s2").orElseThrow().getRemark())
                .isEqualTo("Summary: 2 served from cache.");
    }

    @Test
    void dispatch_cacheHitKeepsTheReusedResultAliveAsLongAsTheSubmission() {
        // Given a result produced by s1
        ingest("s1", Set.of(), Set.of(), file("f1"));
        finish(pop("X"));
        finish(pop("Y"));
        String resultKey = taskState("s1", "f1", "X").getResultKey();
        LocalDateTime firstExpiry = analysisResultRepository.findById(resultKey).orElseThrow().getExpiryTs();

        // When s2 reuses it ten days later
        clock.advance(Duration.ofDays(10));
        ingest("s2", Set.of(), Set.of(), file("f1"));

        // Then the result expires no earlier than s2
        assertThat(taskState("s2", "f1", "X").getStatus()).isEqualTo(TaskStatus.CACHE_HIT);
        LocalDateTime submissionExpiry = submissionRepository.findById("s2").orElseThrow().getExpiryTs();
        LocalDateTime resultExpiry = analysisResultRepository.findById(resultKey).orElseThrow().getExpiryTs();
        assertThat(resultExpiry).isAfter(firstExpiry).isAfterOrEqualTo(submissionExpiry);
    }

    @Test
    void dispatch_runsAgainWhenSubmissionParametersChangeTheConfiguration() {
        ingest("s1", Set.of(), Set.of(), file("f1"));
        finish(pop("X"));
        finish(pop("Y"));
        taskQueue.clear();

        dispatcher.ingest(new SubmissionRequest("s2", Set.of(), Set.of(), Map.of("X", Map.of("deep_scan", true)),
                                                List.of(file("f1"))));

        ServiceTask task = pop("X");
        assertThat(task.config()).containsEntry("deep_scan", true);
        assertThat(taskState("s2", "f1", "X").getStatus()).isEqualTo(TaskStatus.QUEUED);
    }

    @Test
    void registerFile_annotatesFilesThatCannotBeScheduled() {
        ingest("s1", Set.of(), Set.of(), new SubmittedFile("f1", "", "unknown.bin"));

        SubmissionFile file = fileOf("s1", "f1");
        assertThat(file.getState()).isEqualTo(FileDispatchState.DONE);
        assertThat(file.getErrorAnnotation()).contains("file type");
        Submission submission = submissionRepository.findById("s1").orElseThrow();
        assertThat(submission.getStatus()).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(submission.getErrorCount()).isEqualTo(1);
    }

    @Test
    void registerFile_stopsRecursingPastTheExtractionDepthLimit() {
        ingest("s1", Set.of("X"), Set.of("Y"), file("d0"));
        // max-extraction-depth is 3 in the test configuration
        for (int depth = 0; depth < 4; depth++) {
            finish(pop("X"), new ExtractedFile("d" + (depth + 1), TEXT, "nested"));
            finish(pop("Y"));
        }

        SubmissionFile tooDeep = fileOf("s1", "d4");
        assertThat(tooDeep.getState()).isEqualTo(FileDispatchState.DONE);
        assertThat(tooDeep.getErrorAnnotation()).contains("extraction depth 4");
        assertThat(status("s1")).isEqualTo(SubmissionStatus.COMPLETE);
    }

    @Test
    void cancelTask_closesTheStageAndIgnoresTheLateSignal() {
        ingest("s1", Set.of(), Set.of(), file("f1"));
        ServiceTask task = pop("X");

        assertThat(dispatcher.cancelTask("s1", "f1", "X")).isEqualTo(DispatchOutcome.CANCELLED);
        assertThat(taskQueue.size("Y")).isEqualTo(1);
        assertThat(dispatcher.serviceFinished(task, null)).isEqualTo(DispatchOutcome.IGNORED_CANCELLED);
        assertThat(analysisResultRepository.count()).isZero();
    }

    @Test
    void cancelSubmission_withdrawsOutstandingWorkAndCompletes() {
        ingest("s1", Set.of(), Set.of(), file("f1"), file("f2"));
        ServiceTask task = pop("X");

        assertThat(dispatcher.cancelSubmission("s1")).isEqualTo(DispatchOutcome.CANCELLED);

        assertThat(serviceTaskStateRepository.findAllBySubmissionIdAndStatus("s1", TaskStatus.CANCELLED)).hasSize(2);
        assertThat(fileOf("s1", "f1").getErrorAnnotation()).isEqualTo(Dispatcher.CANCELLED_ANNOTATION);
        assertThat(status("s1")).isEqualTo(SubmissionStatus.COMPLETE);
        assertThat(dispatcher.serviceFailed(task, "late")).isEqualTo(DispatchOutcome.IGNORED_CANCELLED);
        assertThat(dispatcher.cancelSubmission("s1")).isEqualTo(DispatchOutcome.IGNORED_DUPLICATE);
    }

    private void register(String name, String category, String stage, int failureLimit) {
        serviceRegistry.register(ServiceDefinition.builder().name(name).category(category).stage(stage)
                                                  .accepts(".*").failureLimit(failureLimit).build());
    }

    private DispatchOutcome ingest(String sid, Set<String> selected, Set<String> excluded, SubmittedFile... files) {
        return dispatcher.ingest(new SubmissionRequest(sid, selected, excluded, Map.of(), List.of(files)));
    }

    private static SubmittedFile file(String sha256) {
        return new SubmittedFile(sha256, TEXT, sha256 + ".txt");
    }

    private ServiceTask pop(String service) {
        return taskQueue.pop(service, null).orElseThrow(() -> new AssertionError("no task queued for " + service));
    }

    private DispatchOutcome finish(ServiceTask task, ExtractedFile... extracted) {
        return dispatcher.serviceFinished(task, new ResultPayload(Map.of("service", task.serviceName()),
                                                                  List.of(extracted)));
    }

    private SubmissionStatus status(String sid) {
        return submissionRepository.findById(sid).orElseThrow().getStatus();
    }

    private SubmissionFile fileOf(String sid, String sha256) {
        return submissionFileRepository.findBySubmissionIdAndSha256(sid, sha256).orElseThrow();
    }

    private ServiceTaskState taskState(String sid, String sha256, String service) {
        return serviceTaskStateRepository.findBySubmissionIdAndSha256AndServiceName(sid, sha256, service)
                                         .orElseThrow();
    }
}
