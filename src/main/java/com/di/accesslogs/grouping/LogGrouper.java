package com.di.accesslogs.grouping;

import com.di.accesslogs.config.AccessLogsSettings;
import com.di.accesslogs.source.LogSourceProfile;
import com.di.accesslogs.source.ObjectKeyFilter;
import com.di.accesslogs.storage.ObjectStore;
import com.di.accesslogs.util.InvocationEventLogger;
import com.di.accesslogs.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Relocates freshly created raw access logs into the date-grouped folder hierarchy.
 *
 * <h3>Per object</h3>
 * <ol>
 *   <li>Skip keys outside the notification filter or not matching the raw key pattern.
 *       Other producers may share the bucket, so this is not an error.</li>
 *   <li>Copy to {@code {groupedFolder}/year=/month=/day=/hour=/{basename}}.</li>
 *   <li>Only after the copy succeeded, delete the source. A failed copy leaves the source in place
 *       for reprocessing.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * All moves of one invocation run on a fixed pool of {@code min(moves, maxConcurrency)} threads.
 * Each future records its own failure via {@code exceptionally}, so {@code allOf} waits for every
 * move instead of stopping at the first error. Moves still pending at the invocation deadline are
 * reported as {@link MoveStage#TIMEOUT}. Every failed key is returned in the {@link GroupingResult}.
 */
@Slf4j
@Service
public class LogGrouper {

    private final ObjectStore objectStore;
    private final ObjectKeyFilter objectFilter;
    private final GroupedKeyResolver keyResolver;
    private final int maxConcurrency;
    private final Duration invocationTimeout;
    private final InvocationEventLogger eventLogger;

    public LogGrouper(ObjectStore objectStore,
                      LogSourceProfile logSource,
                      AccessLogsSettings settings,
                      InvocationEventLogger eventLogger) {
        this.objectStore = objectStore;
        this.objectFilter = logSource.objectFilter();
        this.keyResolver = new GroupedKeyResolver(logSource.rawKeyPattern(), settings.groupedFolder());
        this.maxConcurrency = settings.grouping().maxConcurrency();
        this.invocationTimeout = settings.grouping().invocationTimeout();
        this.eventLogger = eventLogger;
    }

    /**
     * Groups one batch of notifications and returns once every dispatched move has settled.
     */
    public GroupingResult group(List<ObjectCreatedNotification> notifications) {
        List<PlannedMove> moves = new ArrayList<>(notifications.size());
        Set<String> planned = new HashSet<>();
        int skipped = 0;

        for (ObjectCreatedNotification n : notifications) {
            Optional<PlannedMove> move = plan(n);
            if (move.isPresent() && planned.add(n.bucket() + "/" + n.key())) {
                moves.add(move.get());
            } else {
                skipped++;
            }
        }

        log.info("[GROUP] received={} toMove={} skipped={}", notifications.size(), moves.size(), skipped);

        List<MoveFailure> failures = moves.isEmpty() ? List.of() : runParallel(moves);
        GroupingResult result = GroupingResult.builder()
                .invocationId(MDC.get(MdcPropagation.INVOCATION_ID))
                .received(notifications.size())
                .skipped(skipped)
                .moved(moves.size() - failures.size())
                .failures(failures)
                .build();

        logOutcome(result);
        return result;
    }

    /* ------------------------------------------------------------------ */
    /* Private: planning                                                    */
    /* ------------------------------------------------------------------ */

    private Optional<PlannedMove> plan(ObjectCreatedNotification n) {
        if (!objectFilter.matches(n.key())) {
            log.debug("[GROUP] skipping key={} (outside filter {})", n.key(), objectFilter);
            return Optional.empty();
        }
        Optional<String> targetKey = keyResolver.resolve(n.key());
        if (targetKey.isEmpty()) {
            log.debug("[GROUP] skipping key={} (no pattern match)", n.key());
            return Optional.empty();
        }
        if (targetKey.get().equals(n.key())) {
            // deleting after a copy onto itself would lose the object
            log.warn("[GROUP] skipping key={} (already grouped)", n.key());
            return Optional.empty();
        }
        return Optional.of(new PlannedMove(n.bucket(), n.key(), targetKey.get()));
    }

    /* ------------------------------------------------------------------ */
    /* Private: parallel execution                                          */
    /* ------------------------------------------------------------------ */

    private List<MoveFailure> runParallel(List<PlannedMove> moves) {
        int poolSize = Math.min(moves.size(), maxConcurrency);
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "group-move-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(poolSize, tf));

        ConcurrentLinkedQueue<MoveFailure> failures = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(moves.size());

        for (PlannedMove move : moves) {
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(() -> execute(move), executor)
                    .exceptionally(ex -> {
                        failures.add(toFailure(move, ex));
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(invocationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            for (int i = 0; i < moves.size(); i++) {
                PlannedMove move = moves.get(i);
                if (futures.get(i).cancel(true)) {
                    log.error("[GROUP] key={} did not settle within {}", move.sourceKey(), invocationTimeout);
                    failures.add(new MoveFailure(move.bucket(), move.sourceKey(), MoveStage.TIMEOUT,
                            "not settled within " + invocationTimeout));
                }
            }
        } catch (ExecutionException e) {
            // exceptionally() converts every failure into a normal completion
            throw new IllegalStateException("Grouping execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Grouping interrupted", e);
        } finally {
            executor.shutdownNow();
        }

        return new ArrayList<>(failures);
    }

    private void execute(PlannedMove move) {
        try {
            objectStore.copy(move.bucket(), move.sourceKey(), move.targetKey());
        } catch (RuntimeException e) {
            throw new MoveException(MoveStage.COPY, e);
        }
        try {
            objectStore.delete(move.bucket(), move.sourceKey());
        } catch (RuntimeException e) {
            throw new MoveException(MoveStage.DELETE, e);
        }
        log.debug("[GROUP] moved {} -> {}", move.sourceKey(), move.targetKey());
    }

    private static MoveFailure toFailure(PlannedMove move, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        MoveStage stage = MoveStage.COPY;
        if (cause instanceof MoveException) {
            stage = ((MoveException) cause).stage;
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("[GROUP] {} failed for key={}: {}", stage, move.sourceKey(), message);
        return new MoveFailure(move.bucket(), move.sourceKey(), stage, message);
    }

    private void logOutcome(GroupingResult result) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("received", result.getReceived());
        context.put("moved", result.getMoved());
        context.put("skipped", result.getSkipped());
        context.put("failed", result.getFailures().size());
        if (result.hasFailures()) {
            context.put("failedKeys", String.join(",", result.getFailedKeys()));
            eventLogger.logEvent("GROUPING_COMPLETED_WITH_FAILURES", context);
        } else {
            eventLogger.logEvent("GROUPING_COMPLETED", context);
        }
        log.info("[GROUP] successfully moved {} file(s)", result.getMoved());
    }

    private record PlannedMove(String bucket, String sourceKey, String targetKey) {
    }

    private static final class MoveException extends RuntimeException {
        private final MoveStage stage;

        MoveException(MoveStage stage, Throwable cause) {
            super(cause);
            this.stage = stage;
        }
    }
}
