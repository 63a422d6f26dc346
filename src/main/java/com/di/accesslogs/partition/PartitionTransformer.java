package com.di.accesslogs.partition;

import com.di.accesslogs.config.AccessLogsSettings;
import com.di.accesslogs.query.QueryExecutor;
import com.di.accesslogs.source.ColumnTransformationRules;
import com.di.accesslogs.storage.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rewrites one hour of the grouped (text) table into the Parquet table, applying the column
 * transformation rules on the way.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Pick the partition of two hours ago (UTC): that hour is closed and its late uploads have landed.</li>
 *   <li>Optionally delete the objects already under the target partition, so a retried run
 *       replaces rather than duplicates the hour.</li>
 *   <li>{@code INSERT INTO target (cols) SELECT <exprs> FROM source WHERE <partition>}.</li>
 * </ol>
 *
 * <p>A statement that does not complete in time is only logged: the grouped data outlives the
 * lag window, so the hour can be transformed again by an operator.
 */
@Slf4j
@Service
public class PartitionTransformer {

    /** Hours between the current hour and the transformed one. */
    static final int LAG_HOURS = 2;

    private final QueryExecutor queryExecutor;
    private final ObjectStore objectStore;
    private final Clock clock;
    private final AccessLogsSettings settings;

    public PartitionTransformer(QueryExecutor queryExecutor,
                                ObjectStore objectStore,
                                AccessLogsSettings settings,
                                Clock clock) {
        this.queryExecutor = queryExecutor;
        this.objectStore = objectStore;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Transforms the partition of {@value #LAG_HOURS} hours ago.
     *
     * @return {@code true} if the INSERT completed, {@code false} if it timed out
     */
    public boolean transformPreviousPartition(TransformPartitionRequest request) {
        return transform(PartitionHour.offset(Instant.now(clock), -LAG_HOURS), request);
    }

    /**
     * Transforms {@code partition}.
     *
     * @return {@code true} if the INSERT completed, {@code false} if it timed out
     * @throws IllegalArgumentException                               if the request names no columns
     * @throws com.di.accesslogs.query.QueryExecutionFailedException if the INSERT fails
     */
    public boolean transform(PartitionHour partition, TransformPartitionRequest request) {
        List<String> columns = request.getColumnNames();
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Transform request names no output columns");
        }
        ColumnTransformationRules rules = ColumnTransformationRules.of(request.getColumnTransformations());

        log.info("[TRANSFORM] transforming partition {} ({} columns, overrides={})",
                partition, columns.size(), rules.asMap().keySet());

        if (settings.replaceExistingPartition()) {
            purgeTargetPartition(partition);
        }

        AccessLogsSettings.Query query = settings.query();
        String statement = PartitionStatements.insertPartition(
                query.database(), query.targetTable(), query.sourceTable(),
                columns, SelectListBuilder.build(columns, rules), partition);

        boolean completed = queryExecutor.execute(statement, false);
        if (completed) {
            log.info("[TRANSFORM] successfully transformed partition {}", partition);
        }
        return completed;
    }

    private void purgeTargetPartition(PartitionHour partition) {
        String location = partition.location(settings.transformedFolder());
        List<String> existing = objectStore.listKeys(settings.bucket(), location);
        if (existing.isEmpty()) {
            return;
        }
        log.warn("[TRANSFORM] partition {} already holds {} object(s) under {}; deleting before insert",
                partition, existing.size(), location);
        objectStore.deleteAll(settings.bucket(), existing);
    }
}
