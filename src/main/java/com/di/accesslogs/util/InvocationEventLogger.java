package com.di.accesslogs.util;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Emits one structured, JSON-like log line per job invocation so that success and failure counts
 * can be extracted by log-based metrics:
 *
 * <pre>
 * [EVENT] {"eventType": "GROUPING_COMPLETED", "timestamp": "...", "applicationId": "access-logs-1a2b3c4d",
 *          "invocationId": "group-5e6f7a8b", "context": {"received": 3, "moved": 2, "skipped": 1, "failed": 0}}
 * </pre>
 */
@Slf4j
@Component
public class InvocationEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

    private final String applicationId;

    public InvocationEventLogger(@Value("${spring.application.name:access-logs}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public void logEvent(String eventType, Map<String, Object> context) {
        logEvent(eventType, context, null);
    }

    /**
     * @param eventType e.g. {@code PARTITION_CREATED}, {@code TRANSFORMATION_FAILED}
     * @param context   counts and identifiers of the invocation; rendered in insertion order
     * @param exception failure cause, summarized as type and message
     */
    public void logEvent(String eventType, Map<String, Object> context, Throwable exception) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        String invocationId = MDC.get(MdcPropagation.INVOCATION_ID);
        event.put("invocationId", invocationId != null ? invocationId : "unknown");

        Map<String, Object> details = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (exception != null) {
            details.put("errorType", exception.getClass().getName());
            details.put("errorMessage", String.valueOf(exception.getMessage()));
        }
        if (!details.isEmpty()) {
            event.put("context", details);
        }

        String line = format(event);
        if (exception != null) {
            log.error("[EVENT] {}", line);
        } else {
            log.info("[EVENT] {}", line);
        }
    }

    String getApplicationId() {
        return applicationId;
    }

    static String format(Map<String, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append('"').append(escapeJson(entry.getKey())).append("\": ");
            Object value = entry.getValue();
            if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
                sb.append(format(copy));
            } else {
                sb.append('"').append(escapeJson(String.valueOf(value))).append('"');
            }
        }
        return sb.append('}').toString();
    }

    private static String escapeJson(String str) {
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
