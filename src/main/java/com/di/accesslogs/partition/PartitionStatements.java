package com.di.accesslogs.partition;

import java.util.List;

/**
 * SQL text of the two partition statements. Values are the zero-padded strings of
 * {@link PartitionHour}; identifiers come from validated configuration.
 */
public final class PartitionStatements {

    private PartitionStatements() {
    }

    /**
     * Idempotent: registering an existing partition is a no-op.
     */
    public static String addPartitionIfNotExists(String database, String table, PartitionHour partition) {
        return String.format("ALTER TABLE %s.%s ADD IF NOT EXISTS PARTITION ("
                        + "year = '%s', month = '%s', day = '%s', hour = '%s');",
                database, table, partition.year(), partition.month(), partition.day(), partition.hour());
    }

    public static String insertPartition(String database,
                                         String targetTable,
                                         String sourceTable,
                                         List<String> columnNames,
                                         String selectList,
                                         PartitionHour partition) {
        return String.format("INSERT INTO %s.%s (%s) SELECT %s FROM %s.%s "
                        + "WHERE year = '%s' AND month = '%s' AND day = '%s' AND hour = '%s';",
                database, targetTable, String.join(",", columnNames), selectList, database, sourceTable,
                partition.year(), partition.month(), partition.day(), partition.hour());
    }
}
