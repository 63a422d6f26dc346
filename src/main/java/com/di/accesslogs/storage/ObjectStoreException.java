package com.di.accesslogs.storage;

import java.util.List;

/**
 * A storage operation reported per-key errors without failing the request itself.
 */
public class ObjectStoreException extends RuntimeException {

    private final List<String> failedKeys;

    public ObjectStoreException(String message, List<String> failedKeys) {
        super(message + " " + failedKeys);
        this.failedKeys = List.copyOf(failedKeys);
    }

    public List<String> getFailedKeys() {
        return failedKeys;
    }
}
