package com.eyelevel.dispatcher.service.archive;

import java.util.Set;

/**
 * @param sid             archived submission
 * @param fileCount       files of the submission tagged as archived
 * @param resultCount     results tagged as archived
 * @param copiedBlobs     file blobs copied into the archive store
 * @param failedBlobs     sha256 of the files whose blob could not be copied
 */
public record ArchiveReport(String sid, int fileCount, int resultCount, int copiedBlobs, Set<String> failedBlobs) {
}
