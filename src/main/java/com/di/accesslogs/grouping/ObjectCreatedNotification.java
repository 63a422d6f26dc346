package com.di.accesslogs.grouping;

/**
 * One object-created event: the raw log object to relocate. {@code key} is already URL-decoded.
 */
public record ObjectCreatedNotification(String bucket, String key) {
}
