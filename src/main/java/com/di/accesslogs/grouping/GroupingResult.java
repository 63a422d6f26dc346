package com.di.accesslogs.grouping;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one grouping invocation. {@code received = skipped + moved + failures.size()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupingResult {

    private String invocationId;

    private int received;

    /** Keys outside the notification filter or not matching the raw key pattern. */
    private int skipped;

    private int moved;

    @Builder.Default
    private List<MoveFailure> failures = new ArrayList<>();

    public boolean hasFailures() {
        return failures != null && !failures.isEmpty();
    }

    public List<String> getFailedKeys() {
        return failures == null ? List.of() : failures.stream().map(MoveFailure::sourceKey).toList();
    }
}
