package com.di.accesslogs.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Column name to SQL expression overrides applied when a partition is rewritten into the
 * Parquet table. Columns without an entry are copied verbatim.
 *
 * <p>A {@code null} or blank expression means "pass through"; such entries are dropped so
 * that an optional rule (e.g. cookie filtering without a whitelist) never emits {@code AS}.
 */
public final class ColumnTransformationRules {

    private static final ColumnTransformationRules NONE = new ColumnTransformationRules(Map.of());

    private final Map<String, String> expressions;

    private ColumnTransformationRules(Map<String, String> expressions) {
        this.expressions = expressions;
    }

    public static ColumnTransformationRules none() {
        return NONE;
    }

    public static ColumnTransformationRules of(Map<String, String> rules) {
        if (rules == null || rules.isEmpty()) {
            return NONE;
        }
        Map<String, String> effective = new LinkedHashMap<>();
        rules.forEach((column, expression) -> {
            if (column != null && expression != null && !expression.isBlank()) {
                effective.put(column, expression);
            }
        });
        return new ColumnTransformationRules(Collections.unmodifiableMap(effective));
    }

    public Optional<String> expressionFor(String column) {
        return Optional.ofNullable(expressions.get(column));
    }

    public boolean overrides(String column) {
        return expressions.containsKey(column);
    }

    public Map<String, String> asMap() {
        return expressions;
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    @Override
    public String toString() {
        return "ColumnTransformationRules" + expressions.keySet();
    }
}
