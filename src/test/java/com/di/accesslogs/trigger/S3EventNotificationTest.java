package com.di.accesslogs.trigger;

import com.di.accesslogs.grouping.ObjectCreatedNotification;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("S3EventNotification Tests")
class S3EventNotificationTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    @DisplayName("Should bind bucket and key of every record")
    void testToNotifications() throws Exception {
        String body = "{\"Records\":["
                + "{\"eventVersion\":\"2.1\",\"eventName\":\"ObjectCreated:Put\",\"s3\":{\"bucket\":{\"name\":\"logs\",\"arn\":\"arn:aws:s3:::logs\"},"
                + "\"object\":{\"key\":\"unprocessed/E24DN41CDZRLM8.2022-07-20-13.d94543d0.gz\",\"size\":1024}}},"
                + "{\"eventName\":\"ObjectCreated:Put\",\"s3\":{\"bucket\":{\"name\":\"logs\"},"
                + "\"object\":{\"key\":\"unprocessed/E24DN41CDZRLM8.2022-07-20-14.aaaaaaaa.gz\"}}}]}";

        List<ObjectCreatedNotification> notifications = JSON.readValue(body, S3EventNotification.class).toNotifications();

        assertEquals(List.of(
                new ObjectCreatedNotification("logs", "unprocessed/E24DN41CDZRLM8.2022-07-20-13.d94543d0.gz"),
                new ObjectCreatedNotification("logs", "unprocessed/E24DN41CDZRLM8.2022-07-20-14.aaaaaaaa.gz")),
                notifications);
    }

    @Test
    @DisplayName("Should URL-decode object keys")
    void testToNotifications_DecodesKeys() throws Exception {
        String body = "{\"Records\":[{\"s3\":{\"bucket\":{\"name\":\"logs\"},"
                + "\"object\":{\"key\":\"unprocessed/my+logs/E1%3D.2022-07-20-13.abc.gz\"}}}]}";

        List<ObjectCreatedNotification> notifications = JSON.readValue(body, S3EventNotification.class).toNotifications();

        assertEquals("unprocessed/my logs/E1=.2022-07-20-13.abc.gz", notifications.get(0).key());
    }

    @Test
    @DisplayName("Should drop records without bucket or key")
    void testToNotifications_Incomplete() throws Exception {
        String body = "{\"Records\":[{\"s3\":{\"bucket\":{\"name\":\"logs\"}}},{\"eventName\":\"s3:TestEvent\"}]}";

        assertTrue(JSON.readValue(body, S3EventNotification.class).toNotifications().isEmpty());
    }

    @Test
    @DisplayName("Should accept a body without records")
    void testToNotifications_NoRecords() throws Exception {
        assertTrue(JSON.readValue("{\"Service\":\"Amazon S3\",\"Event\":\"s3:TestEvent\"}", S3EventNotification.class)
                .toNotifications().isEmpty());
    }
}
