package com.di.accesslogs.trigger;

import com.di.accesslogs.grouping.ObjectCreatedNotification;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * S3 event notification batch, as delivered by a bucket notification or an EventBridge/SNS
 * forwarder. Only the fields the grouper needs are bound.
 *
 * <pre>{"Records":[{"eventName":"ObjectCreated:Put","s3":{"bucket":{"name":"logs"},"object":{"key":"unprocessed/a.gz"}}}]}</pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class S3EventNotification {

    @JsonProperty("Records")
    private List<Record> records = new ArrayList<>();

    /**
     * Records carrying a bucket and key, with keys URL-decoded ({@code +} is a space).
     */
    public List<ObjectCreatedNotification> toNotifications() {
        List<ObjectCreatedNotification> out = new ArrayList<>();
        if (records == null) {
            return out;
        }
        for (Record record : records) {
            if (record == null || record.getS3() == null
                    || record.getS3().getBucket() == null || record.getS3().getObject() == null) {
                continue;
            }
            String bucket = record.getS3().getBucket().getName();
            String key = record.getS3().getObject().getKey();
            if (bucket == null || key == null) {
                continue;
            }
            out.add(new ObjectCreatedNotification(bucket, decodeKey(key)));
        }
        return out;
    }

    static String decodeKey(String key) {
        return URLDecoder.decode(key, StandardCharsets.UTF_8);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Record {
        private String eventName;
        private S3Entity s3;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class S3Entity {
        private Bucket bucket;
        private S3Object object;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Bucket {
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class S3Object {
        private String key;
        private Long size;
    }
}
