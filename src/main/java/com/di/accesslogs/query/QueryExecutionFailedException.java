package com.di.accesslogs.query;

/**
 * The engine reported FAILED or CANCELLED. Carries the full statement text for diagnosis.
 */
public class QueryExecutionFailedException extends RuntimeException {

    private final String statement;
    private final String executionId;
    private final QueryExecutionState state;

    public QueryExecutionFailedException(String statement, String executionId,
                                         QueryExecutionState state, String reason) {
        super("Command execution " + state + " (executionId=" + executionId + ")"
                + (reason != null && !reason.isBlank() ? ": " + reason : "")
                + "! Query:\n" + statement);
        this.statement = statement;
        this.executionId = executionId;
        this.state = state;
    }

    public String getStatement() {
        return statement;
    }

    public String getExecutionId() {
        return executionId;
    }

    public QueryExecutionState getState() {
        return state;
    }
}
