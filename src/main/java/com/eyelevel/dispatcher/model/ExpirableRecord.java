package com.eyelevel.dispatcher.model;

import java.time.LocalDateTime;

/**
 * A document that the expiry sweep may delete once its expiry timestamp has passed.
 */
public interface ExpirableRecord {

    /**
     * @return The key of the record's blob in its object store, or its identifier when it has no blob.
     */
    String getStorageKey();

    LocalDateTime getExpiryTs();
}
