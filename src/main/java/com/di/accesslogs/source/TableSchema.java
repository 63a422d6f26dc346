package com.di.accesslogs.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared schema of an access log table: regular columns followed by the partition keys.
 *
 * <p>The grouped (text) table and the transformed (Parquet) table share this schema, so the
 * column list of an {@code INSERT ... SELECT} between them is simply {@link #columnNames()}.
 */
public record TableSchema(List<TableColumn> columns, List<TableColumn> partitionKeys) {

    /** Hourly partition keys used by both access log tables. */
    public static final List<TableColumn> HOURLY_PARTITION_KEYS = List.of(
            TableColumn.string("year"),
            TableColumn.string("month"),
            TableColumn.string("day"),
            TableColumn.string("hour"));

    public TableSchema {
        columns = List.copyOf(columns);
        partitionKeys = List.copyOf(partitionKeys);
    }

    public static TableSchema hourly(List<TableColumn> columns) {
        return new TableSchema(columns, HOURLY_PARTITION_KEYS);
    }

    /**
     * Full ordered column list: regular columns in declaration order, then partition keys.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size() + partitionKeys.size());
        columns.forEach(c -> names.add(c.name()));
        partitionKeys.forEach(c -> names.add(c.name()));
        return names;
    }
}
