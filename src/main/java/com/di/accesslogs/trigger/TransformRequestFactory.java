package com.di.accesslogs.trigger;

import com.di.accesslogs.partition.TransformPartitionRequest;
import com.di.accesslogs.source.LogSourceProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Builds the transformation request of the active log source: every target column (regular,
 * then partition keys) and the source's column overrides.
 */
@Component
@RequiredArgsConstructor
public class TransformRequestFactory {

    private final LogSourceProfile profile;

    public TransformPartitionRequest fromActiveSource() {
        return TransformPartitionRequest.builder()
                .columnNames(new ArrayList<>(profile.tableSchema().columnNames()))
                .columnTransformations(new LinkedHashMap<>(profile.columnTransformationRules().asMap()))
                .build();
    }
}
