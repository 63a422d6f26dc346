package com.di.accesslogs.config;

import com.di.accesslogs.source.TransformationOptions;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Validated, immutable pipeline configuration. Built once at startup by
 * {@link AccessLogsProperties#toSettings(java.util.Set)} and shared by every job.
 *
 * @param logSource                configured {@link com.di.accesslogs.source.AccessLogSource} type
 * @param groupedFolder            folder of the date-grouped logs, without leading/trailing slash
 * @param transformedFolder        folder of the Parquet table, without leading/trailing slash
 * @param bucket                   access log bucket; {@code null} when no partition purge is configured
 * @param rawKeyPattern            override of the source's raw key pattern, or {@code null}
 * @param replaceExistingPartition delete the target partition's objects before re-inserting it
 */
public record AccessLogsSettings(String logSource,
                                 String groupedFolder,
                                 String transformedFolder,
                                 String bucket,
                                 Pattern rawKeyPattern,
                                 TransformationOptions transformationOptions,
                                 Query query,
                                 Grouping grouping,
                                 boolean replaceExistingPartition) {

    /**
     * Query engine settings.
     *
     * @param workgroup       Athena workgroup every statement runs in
     * @param database        catalog database holding both tables
     * @param sourceTable     grouped (text) table, target of partition registration
     * @param targetTable     transformed (Parquet) table
     * @param maxPollAttempts status polls before the execution counts as timed out
     * @param pollDelay       pause between two polls
     */
    public record Query(String workgroup,
                        String database,
                        String sourceTable,
                        String targetTable,
                        int maxPollAttempts,
                        Duration pollDelay) {
    }

    /**
     * @param maxConcurrency    upper bound of concurrent object moves in one invocation
     * @param invocationTimeout deadline for all moves of one invocation to settle
     */
    public record Grouping(int maxConcurrency, Duration invocationTimeout) {
    }
}
