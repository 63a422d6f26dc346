package com.di.accesslogs.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC ({@code invocationId}, {@code requestId}) to worker threads so that logs of
 * the concurrent object moves of one grouping invocation stay correlated with it.
 * <p>
 * MDC is thread-local; without propagation, logs from an {@code ExecutorService} do not contain
 * the invocation's correlation ID.
 */
public final class MdcPropagation {

    public static final String INVOCATION_ID = "invocationId";

    private MdcPropagation() {
    }

    /**
     * Puts a fresh {@code invocationId} ({@code job-xxxxxxxx}) into the MDC of the current thread.
     *
     * @return the id, for log messages and responses
     */
    public static String startInvocation(String job) {
        String invocationId = job + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(INVOCATION_ID, invocationId);
        return invocationId;
    }

    public static void endInvocation() {
        MDC.remove(INVOCATION_ID);
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the
     * task on whatever thread runs it, and clears it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * @return copy of the current MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
        }

        @Override
        public void shutdown() {
            delegate.shutdown();
        }

        @Override
        public List<Runnable> shutdownNow() {
            return delegate.shutdownNow();
        }

        @Override
        public boolean isShutdown() {
            return delegate.isShutdown();
        }

        @Override
        public boolean isTerminated() {
            return delegate.isTerminated();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
