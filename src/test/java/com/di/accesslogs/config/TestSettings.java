package com.di.accesslogs.config;

import com.di.accesslogs.source.TransformationOptions;

import java.time.Duration;

/**
 * Settings used across unit tests.
 */
public final class TestSettings {

    public static final String BUCKET = "access-logs";

    private TestSettings() {
    }

    public static AccessLogsSettings settings() {
        return settings(true);
    }

    public static AccessLogsSettings settings(boolean replaceExistingPartition) {
        return new AccessLogsSettings(
                "cloudfront",
                "by-date",
                "transformed",
                BUCKET,
                null,
                TransformationOptions.defaults(),
                new AccessLogsSettings.Query("logs-workgroup", "logs_database",
                        "logs_table_by_date", "logs_table_transformed", 5, Duration.ZERO),
                new AccessLogsSettings.Grouping(4, Duration.ofSeconds(5)),
                replaceExistingPartition);
    }
}
