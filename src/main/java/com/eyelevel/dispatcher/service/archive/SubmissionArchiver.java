package com.eyelevel.dispatcher.service.archive;

import com.eyelevel.dispatcher.common.concurrent.BoundedTaskGroup;
import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.exception.SubmissionNotFoundException;
import com.eyelevel.dispatcher.service.archive.ArchiveRecordService.ArchivedRecords;
import com.eyelevel.dispatcher.storage.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Moves a submission into cold storage: the submission, its files and its results are tagged archived and
 * lose their expiry, and the file blobs are copied from the file store into the archive store.
 */
@Slf4j
@Service
public class SubmissionArchiver {

    public static final String SUBMISSION_TYPE = "submission";

    private final ArchiveRecordService archiveRecordService;
    private final ObjectStore fileStore;
    private final ObjectStore archiveStore;
    private final int workers;

    public SubmissionArchiver(final ArchiveRecordService archiveRecordService,
                              @Qualifier("fileStore") final ObjectStore fileStore,
                              @Qualifier("archiveStore") final ObjectStore archiveStore,
                              final DispatchConfig dispatchConfig) {
        this.archiveRecordService = archiveRecordService;
        this.fileStore = fileStore;
        this.archiveStore = archiveStore;
        this.workers = dispatchConfig.getArchive().getWorkers();
    }

    /**
     * Archives one submission. Records are updated in one transaction before any blob is copied; a blob that
     * cannot be copied is reported and logged without undoing the rest.
     *
     * @param sid         the submission to archive
     * @param deleteAfter remove each file blob from the file store once it was copied
     * @throws SubmissionNotFoundException if no submission has this id
     */
    public ArchiveReport archive(final String sid, final boolean deleteAfter) {
        final ArchivedRecords records = archiveRecordService.markArchived(sid)
                                                            .orElseThrow(() -> new SubmissionNotFoundException(sid));

        if (fileStore.location().equals(archiveStore.location())) {
            log.info("[{}] File store and archive store are the same location. No blob is copied.", sid);
            return new ArchiveReport(sid, records.sha256s().size(), records.resultCount(), 0, Set.of());
        }

        final BoundedTaskGroup.Outcome outcome;
        try (BoundedTaskGroup group = new BoundedTaskGroup("archive-" + sid, workers)) {
            for (String sha256 : records.sha256s()) {
                group.submit(sha256, () -> copyToArchive(sid, sha256, deleteAfter));
            }
            outcome = group.awaitAll();
        }
        outcome.failures().forEach((sha256, error) -> log.error("[{}] Failed to copy file {} to {}: {}", sid, sha256,
                                                                 archiveStore.location(), error.getMessage(), error));
        return new ArchiveReport(sid, records.sha256s().size(), records.resultCount(),
                                 outcome.succeeded().size(), outcome.failures().keySet());
    }

    private Void copyToArchive(final String sid, final String sha256, final boolean deleteAfter) throws IOException {
        final Path temp = Files.createTempFile("archive-" + sha256, ".tmp");
        try {
            fileStore.download(sha256, temp);
            if (Files.size(temp) == 0) {
                log.warn("[{}] Blob of file {} is empty. Nothing is uploaded to the archive.", sid, sha256);
                return null;
            }
            archiveStore.upload(sha256, temp);
            log.debug("[{}] Copied file {} to {}.", sid, sha256, archiveStore.location());
            if (deleteAfter) {
                fileStore.delete(sha256);
            }
            return null;
        } finally {
            FileUtils.deleteQuietly(temp.toFile());
        }
    }
}
