package com.di.accesslogs.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.S3Error;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ObjectStore} on Amazon S3 (SDK v2). SDK exceptions propagate unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class S3ObjectStore implements ObjectStore {

    /** S3 DeleteObjects accepts at most 1000 keys per request. */
    private static final int DELETE_BATCH_SIZE = 1000;

    private final S3Client s3;

    @Override
    public void copy(String bucket, String sourceKey, String targetKey) {
        s3.copyObject(CopyObjectRequest.builder()
                .sourceBucket(bucket)
                .sourceKey(sourceKey)
                .destinationBucket(bucket)
                .destinationKey(targetKey)
                .build());
    }

    @Override
    public void delete(String bucket, String key) {
        s3.deleteObject(DeleteObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build());
    }

    @Override
    public List<String> listKeys(String bucket, String prefix) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .build();
        List<String> keys = new ArrayList<>();
        for (S3Object object : s3.listObjectsV2Paginator(request).contents()) {
            keys.add(object.key());
        }
        return keys;
    }

    @Override
    public void deleteAll(String bucket, List<String> keys) {
        List<String> failed = new ArrayList<>();
        for (int from = 0; from < keys.size(); from += DELETE_BATCH_SIZE) {
            List<ObjectIdentifier> batch = keys.subList(from, Math.min(from + DELETE_BATCH_SIZE, keys.size()))
                    .stream()
                    .map(key -> ObjectIdentifier.builder().key(key).build())
                    .toList();
            DeleteObjectsResponse response = s3.deleteObjects(DeleteObjectsRequest.builder()
                    .bucket(bucket)
                    .delete(Delete.builder().objects(batch).quiet(true).build())
                    .build());
            for (S3Error error : response.errors()) {
                log.error("[S3] delete failed key={} code={} message={}", error.key(), error.code(), error.message());
                failed.add(error.key());
            }
        }
        if (!failed.isEmpty()) {
            throw new ObjectStoreException("Failed to delete " + failed.size() + " object(s) in " + bucket + ":", failed);
        }
    }
}
