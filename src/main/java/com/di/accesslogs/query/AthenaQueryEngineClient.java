package com.di.accesslogs.query;

import com.di.accesslogs.config.AccessLogsSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.model.GetQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.QueryExecutionContext;
import software.amazon.awssdk.services.athena.model.QueryExecutionStatus;
import software.amazon.awssdk.services.athena.model.StartQueryExecutionRequest;

/**
 * Athena implementation. Every statement runs in the configured workgroup with the configured
 * database as its default context; query results go to the workgroup's output location.
 */
@Slf4j
@Component
public class AthenaQueryEngineClient implements QueryEngineClient {

    private final AthenaClient athena;
    private final String workgroup;
    private final String database;

    public AthenaQueryEngineClient(AthenaClient athena, AccessLogsSettings settings) {
        this.athena = athena;
        this.workgroup = settings.query().workgroup();
        this.database = settings.query().database();
    }

    @Override
    public String submit(String statement) {
        StartQueryExecutionRequest request = StartQueryExecutionRequest.builder()
                .queryString(statement)
                .workGroup(workgroup)
                .queryExecutionContext(QueryExecutionContext.builder().database(database).build())
                .build();
        String executionId = athena.startQueryExecution(request).queryExecutionId();
        log.debug("[QUERY] submitted executionId={} workgroup={}", executionId, workgroup);
        return executionId;
    }

    @Override
    public QueryStatus status(String executionId) {
        QueryExecutionStatus status = athena.getQueryExecution(GetQueryExecutionRequest.builder()
                        .queryExecutionId(executionId)
                        .build())
                .queryExecution()
                .status();
        return new QueryStatus(map(status.state()), status.stateChangeReason());
    }

    /** QUEUED and states unknown to this SDK version count as still running. */
    static QueryExecutionState map(software.amazon.awssdk.services.athena.model.QueryExecutionState state) {
        if (state == null) {
            return QueryExecutionState.RUNNING;
        }
        switch (state) {
            case SUCCEEDED:
                return QueryExecutionState.SUCCEEDED;
            case FAILED:
                return QueryExecutionState.FAILED;
            case CANCELLED:
                return QueryExecutionState.CANCELLED;
            default:
                return QueryExecutionState.RUNNING;
        }
    }
}
