package com.di.accesslogs.partition;

import com.di.accesslogs.config.TestSettings;
import com.di.accesslogs.query.QueryExecutionFailedException;
import com.di.accesslogs.query.QueryExecutionState;
import com.di.accesslogs.query.QueryExecutor;
import com.di.accesslogs.query.ScriptedQueryEngine;
import com.di.accesslogs.storage.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.di.accesslogs.config.TestSettings.BUCKET;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionTransformer Tests")
class PartitionTransformerTest {

    private static final Clock AT_13_01 = Clock.fixed(Instant.parse("2022-07-20T13:01:00Z"), ZoneOffset.UTC);

    private InMemoryObjectStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore();
    }

    private PartitionTransformer transformer(ScriptedQueryEngine engine, boolean replaceExisting) {
        QueryExecutor executor = new QueryExecutor(engine, 3, Duration.ZERO, delay -> { });
        return new PartitionTransformer(executor, store, TestSettings.settings(replaceExisting), AT_13_01);
    }

    private static TransformPartitionRequest request() {
        return TransformPartitionRequest.builder()
                .columnNames(List.of("request_ip", "status", "year", "month", "day", "hour"))
                .columnTransformations(Map.of("request_ip", "regexp_replace(request_ip, '(.*\\.|:).*', '$1xxx')"))
                .build();
    }

    @Test
    @DisplayName("Should insert the partition of two hours ago with the column overrides")
    void testTransformPreviousPartition() {
        ScriptedQueryEngine engine = ScriptedQueryEngine.succeeding();

        assertTrue(transformer(engine, false).transformPreviousPartition(request()));

        assertEquals(List.of("INSERT INTO logs_database.logs_table_transformed "
                + "(request_ip,status,year,month,day,hour) "
                + "SELECT regexp_replace(request_ip, '(.*\\.|:).*', '$1xxx') AS request_ip, status, year, month, day, hour "
                + "FROM logs_database.logs_table_by_date "
                + "WHERE year = '2022' AND month = '07' AND day = '20' AND hour = '11';"), engine.statements());
        assertTrue(store.operations().isEmpty());
    }

    @Test
    @DisplayName("Should delete objects of an earlier run before inserting")
    void testTransform_ReplacesExistingPartition() {
        store.put(BUCKET, "transformed/year=2022/month=07/day=20/hour=11/part-0.parquet")
                .put(BUCKET, "transformed/year=2022/month=07/day=20/hour=11/part-1.parquet")
                .put(BUCKET, "transformed/year=2022/month=07/day=20/hour=12/part-0.parquet");
        ScriptedQueryEngine engine = ScriptedQueryEngine.succeeding();

        assertTrue(transformer(engine, true).transformPreviousPartition(request()));

        assertEquals(List.of("transformed/year=2022/month=07/day=20/hour=12/part-0.parquet"),
                store.listKeys(BUCKET, "transformed/"));
        assertEquals(1, engine.statements().size());
    }

    @Test
    @DisplayName("Should skip the purge when the partition is empty")
    void testTransform_NothingToReplace() {
        transformer(ScriptedQueryEngine.succeeding(), true).transform(PartitionHour.of(2022, 7, 20, 11), request());

        assertEquals(List.of("list:transformed/year=2022/month=07/day=20/hour=11/"), store.operations());
    }

    @Test
    @DisplayName("Should return false instead of failing when the insert times out")
    void testTransform_TimeoutTolerated() {
        ScriptedQueryEngine engine = ScriptedQueryEngine.succeeding().runningFor(1);

        assertFalse(transformer(engine, false).transformPreviousPartition(request()));
    }

    @Test
    @DisplayName("Should propagate a failed insert")
    void testTransform_Failure() {
        ScriptedQueryEngine engine = ScriptedQueryEngine.succeeding().then(QueryExecutionState.CANCELLED);

        assertThrows(QueryExecutionFailedException.class,
                () -> transformer(engine, false).transformPreviousPartition(request()));
    }

    @Test
    @DisplayName("Should reject a request without columns")
    void testTransform_EmptyColumns() {
        ScriptedQueryEngine engine = ScriptedQueryEngine.succeeding();
        TransformPartitionRequest empty = TransformPartitionRequest.builder().build();

        assertThrows(IllegalArgumentException.class,
                () -> transformer(engine, true).transformPreviousPartition(empty));
        assertTrue(engine.statements().isEmpty());
    }
}
