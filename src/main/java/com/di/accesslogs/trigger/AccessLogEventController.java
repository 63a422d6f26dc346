package com.di.accesslogs.trigger;

import com.di.accesslogs.grouping.GroupingResult;
import com.di.accesslogs.grouping.LogGrouper;
import com.di.accesslogs.partition.PartitionHour;
import com.di.accesslogs.partition.PartitionRegistrar;
import com.di.accesslogs.partition.PartitionTransformer;
import com.di.accesslogs.partition.TransformPartitionRequest;
import com.di.accesslogs.util.MdcPropagation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP triggers: the object-created webhook that feeds the grouper, and manual registration and
 * transformation of an explicit hour for backfills and operator retries.
 * <p>
 * Hour coordinates are range-checked by bean validation before a handler runs; calendar checks
 * such as February 30 are left to {@link PartitionHour#of(int, int, int, int)}.
 * <p>
 * Failures propagate to {@link com.di.accesslogs.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/access-logs")
@RequiredArgsConstructor
public class AccessLogEventController {

    private final LogGrouper logGrouper;
    private final PartitionRegistrar partitionRegistrar;
    private final PartitionTransformer partitionTransformer;
    private final TransformRequestFactory transformRequestFactory;

    /**
     * Groups the objects of one S3 event notification batch.
     *
     * @return 200 with the per-key outcome; failed keys are listed, not raised
     */
    @PostMapping(path = "/events",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GroupingResult> onObjectsCreated(@RequestBody S3EventNotification event) {
        MdcPropagation.startInvocation("group");
        try {
            return ResponseEntity.ok(logGrouper.group(event.toNotifications()));
        } finally {
            MdcPropagation.endInvocation();
        }
    }

    @PostMapping(path = "/partitions", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PartitionResponse> registerPartition(@RequestParam @Min(1000) @Max(9999) int year,
                                                               @RequestParam @Min(1) @Max(12) int month,
                                                               @RequestParam @Min(1) @Max(31) int day,
                                                               @RequestParam @Min(0) @Max(23) int hour) {
        PartitionHour partition = PartitionHour.of(year, month, day, hour);
        String invocationId = MdcPropagation.startInvocation("create-partition");
        try {
            partitionRegistrar.register(partition);
            return ResponseEntity.ok(PartitionResponse.builder()
                    .invocationId(invocationId)
                    .partition(partition.toString())
                    .completed(true)
                    .message("Partition registered")
                    .build());
        } finally {
            MdcPropagation.endInvocation();
        }
    }

    /**
     * Transforms one hour. Without a body the active log source's schema and rules are used.
     */
    @PostMapping(path = "/partitions/transform", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PartitionResponse> transformPartition(@RequestParam @Min(1000) @Max(9999) int year,
                                                                @RequestParam @Min(1) @Max(12) int month,
                                                                @RequestParam @Min(1) @Max(31) int day,
                                                                @RequestParam @Min(0) @Max(23) int hour,
                                                                @Valid @RequestBody(required = false) TransformPartitionRequest request) {
        PartitionHour partition = PartitionHour.of(year, month, day, hour);
        TransformPartitionRequest effective = request != null ? request : transformRequestFactory.fromActiveSource();
        String invocationId = MdcPropagation.startInvocation("transform-partition");
        try {
            boolean completed = partitionTransformer.transform(partition, effective);
            return ResponseEntity.ok(PartitionResponse.builder()
                    .invocationId(invocationId)
                    .partition(partition.toString())
                    .completed(completed)
                    .message(completed ? "Partition transformed" : "Transformation still running after poll budget")
                    .build());
        } finally {
            MdcPropagation.endInvocation();
        }
    }
}
