package com.di.accesslogs.partition;

import com.di.accesslogs.config.AccessLogsSettings;
import com.di.accesslogs.query.QueryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Registers hourly partitions of the grouped table ahead of use.
 *
 * <p>Runs before the hour starts so the partition exists when its first logs arrive. A missing
 * partition silently hides that hour from every query, so a statement that does not complete in
 * time is an error here, not a warning.
 */
@Slf4j
@Service
public class PartitionRegistrar {

    private final QueryExecutor queryExecutor;
    private final Clock clock;
    private final String database;
    private final String table;

    public PartitionRegistrar(QueryExecutor queryExecutor, AccessLogsSettings settings, Clock clock) {
        this.queryExecutor = queryExecutor;
        this.clock = clock;
        this.database = settings.query().database();
        this.table = settings.query().sourceTable();
    }

    /**
     * Creates the partition of the hour following the current one (UTC).
     *
     * @return the registered partition
     */
    public PartitionHour registerNextHour() {
        PartitionHour nextHour = PartitionHour.offset(Instant.now(clock), 1);
        register(nextHour);
        return nextHour;
    }

    /**
     * Creates {@code partition} if it does not exist yet. Safe to repeat.
     *
     * @throws com.di.accesslogs.query.QueryExecutionFailedException if the statement fails
     * @throws com.di.accesslogs.query.QueryTimeoutException         if it does not complete in time
     */
    public void register(PartitionHour partition) {
        log.info("[PARTITION] creating partition {} on {}.{}", partition, database, table);
        queryExecutor.execute(PartitionStatements.addPartitionIfNotExists(database, table, partition), true);
        log.info("[PARTITION] partition {} successfully created", partition);
    }
}
