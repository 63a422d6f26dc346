package com.di.accesslogs.partition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a transformation run: the full ordered output column list of the target table
 * (regular columns, then partition keys) and the column override expressions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransformPartitionRequest {

    @NotEmpty
    @Builder.Default
    private List<String> columnNames = new ArrayList<>();

    /** Column name to SQL expression; null or blank values pass the column through. */
    @Builder.Default
    private Map<String, String> columnTransformations = new LinkedHashMap<>();
}
