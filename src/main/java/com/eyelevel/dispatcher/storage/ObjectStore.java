package com.eyelevel.dispatcher.storage;

import java.nio.file.Path;

/**
 * A flat key/blob store. Three instances are wired: the file store for submitted and extracted files,
 * the cache store for service artifacts and the archive store for archived submissions.
 */
public interface ObjectStore {

    /**
     * @return A name identifying the backing location, used in logs and to tell stores apart.
     */
    String location();

    void upload(String key, Path source);

    void download(String key, Path target);

    boolean exists(String key);

    /**
     * Deletes the blob. Deleting a missing key is not an error.
     */
    void delete(String key);
}
