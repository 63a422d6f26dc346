package com.di.accesslogs.trigger;

import com.di.accesslogs.exception.ErrorCategory;
import com.di.accesslogs.partition.PartitionHour;
import com.di.accesslogs.partition.PartitionRegistrar;
import com.di.accesslogs.partition.PartitionTransformer;
import com.di.accesslogs.util.InvocationEventLogger;
import com.di.accesslogs.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hourly jobs: register the next hour's partition at minute 55, transform the hour before last at
 * minute 1 (both UTC, crons under {@code cdnlogs.schedule}).
 * <p>
 * A failed run is logged with its {@link ErrorCategory} and not rethrown; the next run (or a
 * manual call of the HTTP trigger) covers it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cdnlogs.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class AccessLogsScheduler {

    private final PartitionRegistrar partitionRegistrar;
    private final PartitionTransformer partitionTransformer;
    private final TransformRequestFactory transformRequestFactory;
    private final InvocationEventLogger eventLogger;

    @Scheduled(cron = "${cdnlogs.schedule.create-partition-cron:0 55 * * * *}", zone = "UTC")
    public void createNextPartition() {
        MdcPropagation.startInvocation("create-partition");
        try {
            PartitionHour partition = partitionRegistrar.registerNextHour();
            eventLogger.logEvent("PARTITION_CREATED", context(partition));
        } catch (Exception e) {
            reportFailure("PARTITION_CREATION_FAILED", e);
        } finally {
            MdcPropagation.endInvocation();
        }
    }

    @Scheduled(cron = "${cdnlogs.schedule.transform-partition-cron:0 1 * * * *}", zone = "UTC")
    public void transformPreviousPartition() {
        MdcPropagation.startInvocation("transform-partition");
        try {
            boolean completed = partitionTransformer.transformPreviousPartition(transformRequestFactory.fromActiveSource());
            eventLogger.logEvent(completed ? "PARTITION_TRANSFORMED" : "PARTITION_TRANSFORM_TIMED_OUT", context(null));
        } catch (Exception e) {
            reportFailure("PARTITION_TRANSFORM_FAILED", e);
        } finally {
            MdcPropagation.endInvocation();
        }
    }

    private void reportFailure(String eventType, Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        Map<String, Object> ctx = context(null);
        ctx.put("errorCategory", category.name());
        eventLogger.logEvent(eventType, ctx, e);
        log.error("[SCHEDULE] {} [{}]: {}", eventType, category.getName(), e.getMessage(), e);
    }

    private static Map<String, Object> context(PartitionHour partition) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        if (partition != null) {
            ctx.put("partition", partition.toString());
        }
        return ctx;
    }
}
