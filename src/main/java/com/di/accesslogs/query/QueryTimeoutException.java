package com.di.accesslogs.query;

import java.time.Duration;

/**
 * No terminal state was observed within the poll budget. The execution keeps running server-side.
 */
public class QueryTimeoutException extends RuntimeException {

    private final String statement;
    private final String executionId;

    public QueryTimeoutException(String statement, String executionId, int attempts, Duration waited) {
        super("Status of query unknown - polled " + attempts + " times over " + waited.toMillis()
                + "ms but executionId=" + executionId + " did not complete. Query:\n" + statement);
        this.statement = statement;
        this.executionId = executionId;
    }

    /** Always {@link QueryExecutionState#TIMED_OUT}. */
    public QueryExecutionState getState() {
        return QueryExecutionState.TIMED_OUT;
    }

    public String getStatement() {
        return statement;
    }

    public String getExecutionId() {
        return executionId;
    }
}
