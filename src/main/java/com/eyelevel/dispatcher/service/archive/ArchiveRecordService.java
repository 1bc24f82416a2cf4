package com.eyelevel.dispatcher.service.archive;

import com.eyelevel.dispatcher.model.AnalysisResult;
import com.eyelevel.dispatcher.model.FileInfo;
import com.eyelevel.dispatcher.model.ServiceTaskState;
import com.eyelevel.dispatcher.model.Submission;
import com.eyelevel.dispatcher.model.SubmissionFile;
import com.eyelevel.dispatcher.model.TaskStatus;
import com.eyelevel.dispatcher.repository.AnalysisResultRepository;
import com.eyelevel.dispatcher.repository.FileInfoRepository;
import com.eyelevel.dispatcher.repository.ServiceTaskStateRepository;
import com.eyelevel.dispatcher.repository.SubmissionFileRepository;
import com.eyelevel.dispatcher.repository.SubmissionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveRecordService {

    private static final Set<TaskStatus> RESULT_STATUSES = Set.of(TaskStatus.SUCCEEDED, TaskStatus.CACHE_HIT);

    private final SubmissionRepository submissionRepository;
    private final SubmissionFileRepository submissionFileRepository;
    private final ServiceTaskStateRepository serviceTaskStateRepository;
    private final AnalysisResultRepository analysisResultRepository;
    private final FileInfoRepository fileInfoRepository;

    /**
     * Tags a submission, its files, their file info and the results it used as archived, and clears their
     * expiry, in a new transaction that commits before any blob is copied.
     *
     * @param sid the submission to archive.
     * @return The archived file hashes and result count, or empty if the submission does not exist.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ArchivedRecords> markArchived(final String sid) {
        final Optional<Submission> found = submissionRepository.findById(sid);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        final Submission submission = found.get();
        submission.setArchived(true);
        submission.setExpiryTs(null);
        submissionRepository.save(submission);

        final List<SubmissionFile> files = submissionFileRepository.findAllBySubmissionId(sid);
        files.forEach(file -> file.setExpiryTs(null));
        submissionFileRepository.saveAll(files);
        serviceTaskStateRepository.updateExpiryForSubmission(sid, null);

        final Set<String> sha256s = files.stream().map(SubmissionFile::getSha256)
                                         .collect(Collectors.toCollection(LinkedHashSet::new));
        final List<FileInfo> fileInfos = fileInfoRepository.findAllBySha256In(sha256s);
        fileInfos.forEach(info -> {
            info.setArchived(true);
            info.setExpiryTs(null);
        });
        fileInfoRepository.saveAll(fileInfos);

        final Set<String> resultKeys = serviceTaskStateRepository.findAllBySubmissionId(sid).stream()
                                                                 .filter(state -> RESULT_STATUSES.contains(
                                                                         state.getStatus()))
                                                                 .map(ServiceTaskState::getResultKey)
                                                                 .collect(Collectors.toSet());
        final List<AnalysisResult> results = resultKeys.isEmpty() ? List.of()
                                                                  : analysisResultRepository.findAllByResultKeyIn(
                                                                          resultKeys);
        results.forEach(result -> {
            result.setArchived(true);
            result.setExpiryTs(null);
        });
        analysisResultRepository.saveAll(results);

        log.info("[{}] Tagged submission, {} file(s) and {} result(s) as archived.", sid, files.size(),
                 results.size());
        return Optional.of(new ArchivedRecords(sha256s, results.size()));
    }

    public record ArchivedRecords(Set<String> sha256s, int resultCount) {
    }
}
