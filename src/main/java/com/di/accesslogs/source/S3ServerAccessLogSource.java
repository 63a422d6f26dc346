package com.di.accesslogs.source;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * S3 server access logs.
 *
 * <p>Key format: {@code {prefix}{year}-{month}-{day}-{hour}-{minute}-{second}-{unique_id}},
 * e.g. {@code unprocessed/2023-10-05-14-22-31-7C4E1C8A9B2D3F10}. The objects are uncompressed
 * and carry no suffix.
 */
@Component
public class S3ServerAccessLogSource implements AccessLogSource {

    public static final String TYPE = "s3";

    private static final Pattern RAW_KEY_PATTERN = Pattern.compile(
            "(?:^|/)(?<year>\\d{4})-(?<month>\\d{2})-(?<day>\\d{2})-(?<hour>\\d{2})-\\d{2}-\\d{2}-\\w+$");

    private static final TableSchema SCHEMA = TableSchema.hourly(List.of(
            TableColumn.string("bucketowner"),
            TableColumn.string("bucket_name"),
            TableColumn.string("requestdatetime"),
            TableColumn.string("remoteip"),
            TableColumn.string("requester"),
            TableColumn.string("requestid"),
            TableColumn.string("operation"),
            TableColumn.string("key"),
            TableColumn.string("request_uri"),
            TableColumn.string("httpstatus"),
            TableColumn.string("errorcode"),
            TableColumn.of("bytessent", "bigint"),
            TableColumn.of("objectsize", "bigint"),
            TableColumn.string("totaltime"),
            TableColumn.string("turnaroundtime"),
            TableColumn.string("referrer"),
            TableColumn.string("useragent"),
            TableColumn.string("versionid"),
            TableColumn.string("hostid"),
            TableColumn.string("sigv"),
            TableColumn.string("ciphersuite"),
            TableColumn.string("authtype"),
            TableColumn.string("endpoint"),
            TableColumn.string("tlsversion"),
            TableColumn.string("accesspointarn"),
            TableColumn.string("aclrequired")));

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Pattern rawKeyPattern() {
        return RAW_KEY_PATTERN;
    }

    @Override
    public ObjectKeyFilter unprocessedObjectsFilter() {
        return new ObjectKeyFilter(CloudFrontAccessLogSource.UNPROCESSED_PREFIX, "");
    }

    @Override
    public TableSchema tableSchema() {
        return SCHEMA;
    }

    /** S3 logs carry no cookies; the whitelist is ignored. */
    @Override
    public ColumnTransformationRules columnTransformationRules(TransformationOptions options) {
        if (!options.anonymizeClientIp()) {
            return ColumnTransformationRules.none();
        }
        return ColumnTransformationRules.of(Map.of("remoteip", "regexp_replace(remoteip, '(.*\\.|:).*', '$1xxx')"));
    }
}
