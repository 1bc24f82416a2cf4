package com.eyelevel.dispatcher.scheduler;

import com.eyelevel.dispatcher.common.concurrent.BoundedTaskGroup;
import com.eyelevel.dispatcher.config.DispatchConfig;
import com.eyelevel.dispatcher.model.ExpirableRecord;
import com.eyelevel.dispatcher.repository.AnalysisResultRepository;
import com.eyelevel.dispatcher.repository.CachedFileRepository;
import com.eyelevel.dispatcher.repository.FileInfoRepository;
import com.eyelevel.dispatcher.repository.ServiceTaskStateRepository;
import com.eyelevel.dispatcher.repository.SubmissionFileRepository;
import com.eyelevel.dispatcher.repository.SubmissionRepository;
import com.eyelevel.dispatcher.storage.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Periodically deletes records whose expiry timestamp has passed, together with their blobs when configured.
 * Each collection is swept independently; a failure in one is logged and retried on the next run.
 */
@Slf4j
@Component
public class ExpiryScheduler {

    private final List<ExpirableCollection<?>> collections;
    private final DispatchConfig.Expiry settings;
    private final Clock clock;

    public ExpiryScheduler(final SubmissionRepository submissionRepository,
                           final SubmissionFileRepository submissionFileRepository,
                           final ServiceTaskStateRepository serviceTaskStateRepository,
                           final AnalysisResultRepository analysisResultRepository,
                           final FileInfoRepository fileInfoRepository,
                           final CachedFileRepository cachedFileRepository,
                           @Qualifier("fileStore") final ObjectStore fileStore,
                           @Qualifier("cacheStore") final ObjectStore cacheStore,
                           final DispatchConfig dispatchConfig, final Clock clock) {
        this(List.of(new ExpirableCollection<>("submission", submissionRepository, null),
                     new ExpirableCollection<>("submission_file", submissionFileRepository, null),
                     new ExpirableCollection<>("service_task_state", serviceTaskStateRepository, null),
                     new ExpirableCollection<>("analysis_result", analysisResultRepository, null),
                     new ExpirableCollection<>("file_info", fileInfoRepository, fileStore),
                     new ExpirableCollection<>("cached_file", cachedFileRepository, cacheStore)),
             dispatchConfig.getExpiry(), clock);
    }

    ExpiryScheduler(final List<ExpirableCollection<?>> collections, final DispatchConfig.Expiry settings,
                    final Clock clock) {
        this.collections = collections;
        this.settings = settings;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.dispatch.expiry.sleep-time-ms:300000}",
            initialDelayString = "${app.dispatch.expiry.sleep-time-ms:300000}")
    public void sweep() {
        final LocalDateTime cutoff = cutoff();
        log.info("Starting expiry sweep for records that expired before {}.", cutoff);

        long deleted = 0;
        int failed = 0;
        for (ExpirableCollection<?> collection : collections) {
            try {
                deleted += sweep(collection, cutoff);
            } catch (Exception e) {
                failed++;
                log.error("Expiry sweep of '{}' failed. It will be retried on the next run.", collection.name(), e);
            }
        }
        log.info("Finished expiry sweep. Summary: {} records deleted, {} collections failed.", deleted, failed);
    }

    /**
     * Records expiring before this instant are deleted. With batch deletes enabled it is truncated to the day,
     * so a run removes whole days at once.
     */
    LocalDateTime cutoff() {
        final LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(settings.getDelayHours());
        return settings.isBatchDelete() ? cutoff.truncatedTo(ChronoUnit.DAYS) : cutoff;
    }

    <T extends ExpirableRecord> long sweep(final ExpirableCollection<T> collection, final LocalDateTime cutoff) {
        final long expired = collection.repository().countByExpiryTsBefore(cutoff);
        if (expired == 0) {
            log.debug("No expired records in '{}'.", collection.name());
            return 0;
        }
        log.info("Deleting {} expired records from '{}'.", expired, collection.name());

        final int batchSize = Math.max(1, settings.getBatchSize());
        final long maxRounds = expired / batchSize + 1;
        long deleted = 0;
        for (long round = 0; round < maxRounds; round++) {
            final Slice<T> batch = collection.repository().findByExpiryTsBefore(cutoff, PageRequest.of(0, batchSize));
            if (!batch.hasContent()) {
                break;
            }
            final List<T> records = batch.getContent();
            if (settings.isDeleteStorage() && collection.blobStore() != null) {
                deleteBlobs(collection, records);
            }
            collection.repository().deleteAllInBatch(records);
            deleted += records.size();
            if (!batch.hasNext()) {
                break;
            }
        }
        log.info("Deleted {} expired records from '{}'.", deleted, collection.name());
        return deleted;
    }

    private void deleteBlobs(final ExpirableCollection<?> collection, final List<? extends ExpirableRecord> records) {
        final ObjectStore store = collection.blobStore();
        try (BoundedTaskGroup group = new BoundedTaskGroup("expiry-" + collection.name(), settings.getWorkers())) {
            for (ExpirableRecord record : records) {
                final String key = record.getStorageKey();
                group.submit(key, () -> store.delete(key));
            }
            group.awaitAllOrThrow();
        }
        log.debug("Deleted {} blobs from {}.", records.size(), store.location());
    }
}
