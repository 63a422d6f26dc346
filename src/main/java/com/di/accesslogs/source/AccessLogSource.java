package com.di.accesslogs.source;

import java.util.regex.Pattern;

/**
 * Producer-specific knowledge about one access log format.
 *
 * <p>The pipeline itself is format-agnostic: it is handed the raw key pattern, the table
 * schema and the column rules of the configured source and never inspects the format.
 * Implementations are Spring beans picked up by {@link AccessLogSourceRegistry}.
 */
public interface AccessLogSource {

    /** The source type key used in configuration, e.g. {@code cloudfront}. */
    String type();

    /**
     * Pattern identifying raw log objects of this producer. Must declare the named groups
     * {@code year}, {@code month}, {@code day} and {@code hour}; matched with find semantics.
     */
    Pattern rawKeyPattern();

    /** Prefix/suffix filter registered on the object-created notification. */
    ObjectKeyFilter unprocessedObjectsFilter();

    /** Schema shared by the grouped and the transformed table. */
    TableSchema tableSchema();

    /** Column overrides applied when a partition is rewritten into the columnar table. */
    ColumnTransformationRules columnTransformationRules(TransformationOptions options);
}
