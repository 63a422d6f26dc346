package com.di.accesslogs.config;

import com.di.accesslogs.source.TransformationOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Binding for all access log pipeline configuration.
 *
 * <pre>
 * cdnlogs:
 *   log-source: cloudfront
 *   aws-region: eu-west-1      # optional, defaults to the SDK region chain
 *   grouped-folder: by-date
 *   transformed-folder: transformed
 *   bucket: my-access-logs
 *   raw-key-pattern:            # optional, defaults to the log source's pattern
 *   anonymize-client-ip: true
 *   cookie-whitelist: [session, consent]
 *   query:
 *     workgroup: logs-workgroup
 *     database: logs_database
 *     source-table: logs_table_by_date
 *     target-table: logs_table_transformed
 *     max-poll-attempts: 50
 *     poll-delay: 200ms
 *   grouping:
 *     max-concurrency: 16
 *     invocation-timeout: 20s
 *   transform:
 *     replace-existing-partition: true
 *   schedule:
 *     enabled: true
 *     create-partition-cron: "0 55 * * * *"
 *     transform-partition-cron: "0 1 * * * *"
 * </pre>
 *
 * <p>Nothing here is read directly by the jobs: {@link #toSettings(Set)} validates the whole
 * binding once and produces an {@link AccessLogsSettings} value.
 */
@Data
@ConfigurationProperties(prefix = "cdnlogs")
public class AccessLogsProperties {

    static final String PREFIX = "cdnlogs.";

    private static final List<String> REQUIRED_GROUPS = List.of("year", "month", "day", "hour");

    private String logSource = "cloudfront";

    /** Read by {@link AwsClientConfig}; blank falls back to the SDK region chain. */
    private String awsRegion;

    /** Target folder of the grouper, e.g. {@code by-date}. */
    private String groupedFolder;

    /** Folder holding the Parquet table's objects, e.g. {@code transformed}. */
    private String transformedFolder = "transformed";

    /** Access log bucket. Required when {@code transform.replace-existing-partition} is on. */
    private String bucket;

    /** Optional override of the log source's raw key pattern (named groups year, month, day, hour). */
    private String rawKeyPattern;

    private boolean anonymizeClientIp = true;

    private List<String> cookieWhitelist = new ArrayList<>();

    private Query query = new Query();

    private Grouping grouping = new Grouping();

    private Transform transform = new Transform();

    private Schedule schedule = new Schedule();

    @Data
    public static class Query {
        private String workgroup;
        private String database;
        private String sourceTable;
        private String targetTable;
        private int maxPollAttempts = 50;
        private Duration pollDelay = Duration.ofMillis(200);
    }

    @Data
    public static class Grouping {
        private int maxConcurrency = 16;
        private Duration invocationTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Transform {
        private boolean replaceExistingPartition = true;
    }

    @Data
    public static class Schedule {
        private boolean enabled = true;
        private String createPartitionCron = "0 55 * * * *";
        private String transformPartitionCron = "0 1 * * * *";
    }

    /**
     * Validates the binding and converts it into settings.
     *
     * @param registeredSourceTypes log source types known to the application
     * @throws ConfigurationException listing every missing key and invalid value
     */
    public AccessLogsSettings toSettings(Set<String> registeredSourceTypes) {
        List<String> missing = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        String source = require("log-source", logSource, missing);
        String grouped = require("grouped-folder", trimSlashes(groupedFolder), missing);
        String workgroup = require("query.workgroup", query.getWorkgroup(), missing);
        String database = require("query.database", query.getDatabase(), missing);
        String sourceTable = require("query.source-table", query.getSourceTable(), missing);
        String targetTable = require("query.target-table", query.getTargetTable(), missing);

        boolean replace = transform.isReplaceExistingPartition();
        String transformed = trimSlashes(transformedFolder);
        String logBucket = isBlank(bucket) ? null : bucket.trim();
        if (replace) {
            require("bucket", logBucket, missing);
            require("transformed-folder", transformed, missing);
        }

        if (source != null && !registeredSourceTypes.contains(source.trim().toLowerCase())) {
            invalid.add(PREFIX + "log-source '" + source + "' is not one of " + registeredSourceTypes);
        }
        Pattern pattern = compileRawKeyPattern(invalid);
        if (query.getMaxPollAttempts() < 1) {
            invalid.add(PREFIX + "query.max-poll-attempts must be at least 1");
        }
        if (query.getPollDelay() == null || query.getPollDelay().isNegative()) {
            invalid.add(PREFIX + "query.poll-delay must not be negative");
        }
        if (grouping.getMaxConcurrency() < 1) {
            invalid.add(PREFIX + "grouping.max-concurrency must be at least 1");
        }
        if (grouping.getInvocationTimeout() == null || grouping.getInvocationTimeout().isNegative()
                || grouping.getInvocationTimeout().isZero()) {
            invalid.add(PREFIX + "grouping.invocation-timeout must be positive");
        }

        if (!missing.isEmpty() || !invalid.isEmpty()) {
            throw new ConfigurationException(missing, invalid);
        }

        return new AccessLogsSettings(
                source.trim().toLowerCase(),
                grouped,
                transformed,
                logBucket,
                pattern,
                new TransformationOptions(anonymizeClientIp, cookieWhitelist),
                new AccessLogsSettings.Query(workgroup, database, sourceTable, targetTable,
                        query.getMaxPollAttempts(), query.getPollDelay()),
                new AccessLogsSettings.Grouping(grouping.getMaxConcurrency(), grouping.getInvocationTimeout()),
                replace);
    }

    private Pattern compileRawKeyPattern(List<String> invalid) {
        if (isBlank(rawKeyPattern)) {
            return null;
        }
        Pattern compiled;
        try {
            compiled = Pattern.compile(rawKeyPattern);
        } catch (PatternSyntaxException e) {
            invalid.add(PREFIX + "raw-key-pattern does not compile: " + e.getDescription());
            return null;
        }
        for (String group : REQUIRED_GROUPS) {
            if (!rawKeyPattern.contains("(?<" + group + ">")) {
                invalid.add(PREFIX + "raw-key-pattern lacks named group '" + group + "'");
            }
        }
        return compiled;
    }

    private static String require(String key, String value, List<String> missing) {
        if (isBlank(value)) {
            missing.add(PREFIX + key);
            return null;
        }
        return value.trim();
    }

    private static String trimSlashes(String folder) {
        if (folder == null) {
            return null;
        }
        String trimmed = folder.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
