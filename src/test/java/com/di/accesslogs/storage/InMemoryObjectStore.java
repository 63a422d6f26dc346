package com.di.accesslogs.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link ObjectStore} for tests. Keys are stored as {@code bucket/key};
 * individual keys can be made to fail on copy or delete.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final Set<String> objects = ConcurrentHashMap.newKeySet();
    private final Set<String> failOnCopy = ConcurrentHashMap.newKeySet();
    private final Set<String> failOnDelete = ConcurrentHashMap.newKeySet();
    private final List<String> operations = Collections.synchronizedList(new ArrayList<>());

    public InMemoryObjectStore put(String bucket, String key) {
        objects.add(bucket + "/" + key);
        return this;
    }

    public void failCopyOf(String key) {
        failOnCopy.add(key);
    }

    public void failDeleteOf(String key) {
        failOnDelete.add(key);
    }

    public boolean contains(String bucket, String key) {
        return objects.contains(bucket + "/" + key);
    }

    public Set<String> objects() {
        return new HashSet<>(objects);
    }

    /** Operations in call order, e.g. {@code copy:a->b}, {@code delete:a}. */
    public List<String> operations() {
        synchronized (operations) {
            return new ArrayList<>(operations);
        }
    }

    @Override
    public void copy(String bucket, String sourceKey, String targetKey) {
        operations.add("copy:" + sourceKey + "->" + targetKey);
        if (failOnCopy.contains(sourceKey)) {
            throw new IllegalStateException("copy refused for " + sourceKey);
        }
        if (!objects.contains(bucket + "/" + sourceKey)) {
            throw new IllegalStateException("NoSuchKey " + sourceKey);
        }
        objects.add(bucket + "/" + targetKey);
    }

    @Override
    public void delete(String bucket, String key) {
        operations.add("delete:" + key);
        if (failOnDelete.contains(key)) {
            throw new IllegalStateException("delete refused for " + key);
        }
        objects.remove(bucket + "/" + key);
    }

    @Override
    public List<String> listKeys(String bucket, String prefix) {
        operations.add("list:" + prefix);
        TreeMap<String, String> sorted = new TreeMap<>();
        String bucketPrefix = bucket + "/";
        for (String object : objects) {
            if (object.startsWith(bucketPrefix + prefix)) {
                String key = object.substring(bucketPrefix.length());
                sorted.put(key, key);
            }
        }
        return new ArrayList<>(sorted.keySet());
    }

    @Override
    public void deleteAll(String bucket, List<String> keys) {
        operations.add("deleteAll:" + keys.size());
        keys.forEach(key -> objects.remove(bucket + "/" + key));
    }
}
