package com.di.accesslogs.query;

import java.time.Duration;

/**
 * Pause between two status polls.
 */
@FunctionalInterface
public interface PollSleeper {

    PollSleeper THREAD_SLEEP = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
