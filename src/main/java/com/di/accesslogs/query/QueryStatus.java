package com.di.accesslogs.query;

/**
 * Snapshot of an execution's status.
 *
 * @param state             current state
 * @param stateChangeReason engine-supplied reason, usually only present for FAILED/CANCELLED
 */
public record QueryStatus(QueryExecutionState state, String stateChangeReason) {

    public static QueryStatus of(QueryExecutionState state) {
        return new QueryStatus(state, null);
    }
}
