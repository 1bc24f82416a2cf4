package com.eyelevel.dispatcher.scheduler;

import com.eyelevel.dispatcher.model.ExpirableRecord;
import com.eyelevel.dispatcher.repository.ExpirableRepository;
import com.eyelevel.dispatcher.storage.ObjectStore;

/**
 * A collection visited by the expiry sweep.
 *
 * @param name       collection name used in logs
 * @param repository the records
 * @param blobStore  where the records' blobs live, {@code null} when they have none
 */
public record ExpirableCollection<T extends ExpirableRecord>(String name, ExpirableRepository<T, ?> repository,
                                                             ObjectStore blobStore) {
}
