package com.di.accesslogs.partition;

import com.di.accesslogs.source.ColumnTransformationRules;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the SELECT list of the partition rewrite: one fragment per output column, in the given
 * order. Overridden columns become {@code <expression> AS <column>}, all others are selected by name.
 */
public final class SelectListBuilder {

    private SelectListBuilder() {
    }

    public static String build(List<String> columnNames, ColumnTransformationRules rules) {
        return columnNames.stream()
                .map(column -> columnExpression(column, rules))
                .collect(Collectors.joining(", "));
    }

    static String columnExpression(String column, ColumnTransformationRules rules) {
        Optional<String> expression = rules.expressionFor(column);
        return expression.map(e -> e + " AS " + column).orElse(column);
    }
}
