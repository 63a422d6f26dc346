package com.di.accesslogs.source;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Registry of the {@link AccessLogSource} beans, keyed by their normalized type
 * (case-insensitive, trimmed).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessLogSourceRegistry {

    private final List<AccessLogSource> sources;

    private Map<String, AccessLogSource> sourcesByType = Collections.emptyMap();

    /**
     * Registers all discovered sources. Called after dependency injection.
     *
     * @throws IllegalStateException on a blank or duplicate type
     */
    @PostConstruct
    void initialize() {
        if (sources == null || sources.isEmpty()) {
            log.warn("No AccessLogSource beans found. Registry will be empty.");
            return;
        }

        Map<String, List<AccessLogSource>> grouped = sources.stream()
                .peek(AccessLogSourceRegistry::validateType)
                .collect(Collectors.groupingBy(source -> normalizeType(source.type())));

        String duplicates = grouped.entrySet().stream()
                .filter(entry -> entry.getValue().size() > 1)
                .map(entry -> String.format("'%s' -> %s", entry.getKey(), entry.getValue().stream()
                        .map(source -> source.getClass().getName())
                        .toList()))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate AccessLogSource type() values detected: " + duplicates);
        }

        sourcesByType = grouped.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, entry -> entry.getValue().get(0)));
        log.info("Registered {} access log source type(s): {}", sourcesByType.size(), sourcesByType.keySet());
    }

    /**
     * @throws IllegalArgumentException if no source is registered for {@code type}
     */
    public AccessLogSource getSource(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Access log source type cannot be null or blank");
        }
        AccessLogSource source = sourcesByType.get(normalizeType(type));
        if (source == null) {
            throw new IllegalArgumentException(String.format(
                    "Unsupported access log source: '%s'. Available types: %s", type, sourcesByType.keySet()));
        }
        return source;
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(sourcesByType.keySet());
    }

    private static void validateType(AccessLogSource source) {
        if (source.type() == null || source.type().isBlank()) {
            throw new IllegalStateException(String.format(
                    "AccessLogSource %s returned blank type()", source.getClass().getName()));
        }
    }

    private static String normalizeType(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
