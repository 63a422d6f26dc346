package com.di.accesslogs.query;

/**
 * Lifecycle of one submitted statement as seen by {@link QueryExecutor}.
 * {@link #TIMED_OUT} never comes from the engine; it marks "no terminal state within the poll budget".
 */
public enum QueryExecutionState {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    /** States after which the engine will not report anything else. {@link #TIMED_OUT} is local and excluded. */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
