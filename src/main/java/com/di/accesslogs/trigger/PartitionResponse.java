package com.di.accesslogs.trigger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a manual partition registration or transformation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionResponse {
    private String invocationId;
    private String partition;
    /** {@code false} only for a transformation whose INSERT did not complete within the poll budget. */
    private boolean completed;
    private String message;
}
