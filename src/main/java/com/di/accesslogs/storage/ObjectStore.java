package com.di.accesslogs.storage;

import java.util.List;

/**
 * The object storage operations the pipeline needs. Implementations throw unchecked exceptions
 * on failure; nothing is retried here.
 */
public interface ObjectStore {

    /** Server-side copy within one bucket. */
    void copy(String bucket, String sourceKey, String targetKey);

    void delete(String bucket, String key);

    /** All keys under {@code prefix}, in listing order. */
    List<String> listKeys(String bucket, String prefix);

    /**
     * Deletes the given keys in as few requests as possible.
     *
     * @throws ObjectStoreException if any key could not be deleted
     */
    void deleteAll(String bucket, List<String> keys);
}
