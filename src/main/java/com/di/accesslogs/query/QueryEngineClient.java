package com.di.accesslogs.query;

/**
 * Query-over-object-storage engine: submit a statement, then look up its status by id.
 */
public interface QueryEngineClient {

    /**
     * Starts the statement and returns its execution id without waiting for it.
     */
    String submit(String statement);

    QueryStatus status(String executionId);
}
