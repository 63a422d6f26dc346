package com.di.accesslogs.query;

import com.di.accesslogs.config.AccessLogsSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Submits one statement and polls for its outcome under a bounded attempt/delay budget.
 *
 * <h3>State machine</h3>
 * <pre>
 *   SUBMITTED ─► poll #1 .. #maxAttempts (pollDelay after every non-terminal poll)
 *                 ├─ SUCCEEDED            → return true
 *                 ├─ FAILED / CANCELLED   → throw QueryExecutionFailedException (no further polls)
 *                 └─ RUNNING              → next poll
 *   budget exhausted ─► TIMED_OUT
 *                 ├─ failOnTimeout=true   → throw QueryTimeoutException
 *                 └─ failOnTimeout=false  → log, return false
 * </pre>
 *
 * <p>Worst-case blocking time is {@code maxAttempts × pollDelay} (10s with the defaults). Nothing is
 * cancelled on timeout: the execution keeps running in the engine.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final QueryEngineClient engine;
    private final int maxAttempts;
    private final Duration pollDelay;
    private final PollSleeper sleeper;

    @Autowired
    public QueryExecutor(QueryEngineClient engine, AccessLogsSettings settings) {
        this(engine, settings.query().maxPollAttempts(), settings.query().pollDelay(), PollSleeper.THREAD_SLEEP);
    }

    public QueryExecutor(QueryEngineClient engine, int maxAttempts, Duration pollDelay, PollSleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.engine = engine;
        this.maxAttempts = maxAttempts;
        this.pollDelay = pollDelay;
        this.sleeper = sleeper;
    }

    /**
     * Executes {@code statement} and waits for a terminal state.
     *
     * @param failOnTimeout {@code true} to throw when no terminal state is observed in time,
     *                      {@code false} to only log it
     * @return {@code true} on success, {@code false} if the statement timed out and
     *         {@code failOnTimeout} was {@code false}
     * @throws QueryExecutionFailedException if the engine reports FAILED or CANCELLED
     * @throws QueryTimeoutException         on timeout when {@code failOnTimeout} is set
     */
    public boolean execute(String statement, boolean failOnTimeout) {
        log.info("[QUERY] executing command {} ...", statement);
        String executionId = engine.submit(statement);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            QueryStatus status = engine.status(executionId);
            if (status.state() == QueryExecutionState.SUCCEEDED) {
                log.info("[QUERY] executionId={} completed successfully after {} poll(s)", executionId, attempt);
                return true;
            }
            if (status.state().isTerminal()) {
                throw new QueryExecutionFailedException(
                        statement, executionId, status.state(), status.stateChangeReason());
            }
            pause(executionId);
        }

        QueryTimeoutException timeout = new QueryTimeoutException(
                statement, executionId, maxAttempts, pollDelay.multipliedBy(maxAttempts));
        if (failOnTimeout) {
            throw timeout;
        }
        log.error("[QUERY] {}", timeout.getMessage());
        return false;
    }

    private void pause(String executionId) {
        try {
            sleeper.sleep(pollDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for executionId=" + executionId, e);
        }
    }
}
