package com.di.accesslogs.source;

import java.util.regex.Pattern;

/**
 * The capabilities of the configured log source, resolved once at startup and injected into the
 * grouping and transformation jobs.
 *
 * @param type                      source type key, e.g. {@code cloudfront}
 * @param rawKeyPattern             effective raw key pattern (configured override or the source default)
 * @param objectFilter              notification prefix/suffix filter
 * @param tableSchema               schema of the grouped and transformed tables
 * @param columnTransformationRules column overrides for the Parquet rewrite
 */
public record LogSourceProfile(String type,
                               Pattern rawKeyPattern,
                               ObjectKeyFilter objectFilter,
                               TableSchema tableSchema,
                               ColumnTransformationRules columnTransformationRules) {

    public static LogSourceProfile of(AccessLogSource source, Pattern rawKeyPatternOverride, TransformationOptions options) {
        return new LogSourceProfile(
                source.type(),
                rawKeyPatternOverride != null ? rawKeyPatternOverride : source.rawKeyPattern(),
                source.unprocessedObjectsFilter(),
                source.tableSchema(),
                source.columnTransformationRules(options));
    }
}
