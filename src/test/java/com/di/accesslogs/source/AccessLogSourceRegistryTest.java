package com.di.accesslogs.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The registry is initialized by hand; Spring would call {@code initialize()} after injection.
 */
@DisplayName("AccessLogSourceRegistry Tests")
class AccessLogSourceRegistryTest {

    private static AccessLogSourceRegistry registry(List<AccessLogSource> sources) {
        AccessLogSourceRegistry registry = new AccessLogSourceRegistry(sources);
        registry.initialize();
        return registry;
    }

    @Test
    @DisplayName("Should resolve both built-in sources case-insensitively")
    void testGetSource() {
        AccessLogSourceRegistry registry = registry(List.of(new CloudFrontAccessLogSource(), new S3ServerAccessLogSource()));

        assertEquals(Set.of("cloudfront", "s3"), registry.getRegisteredTypes());
        assertInstanceOf(CloudFrontAccessLogSource.class, registry.getSource(" CloudFront "));
        assertInstanceOf(S3ServerAccessLogSource.class, registry.getSource("S3"));
    }

    @Test
    @DisplayName("Should throw for an unknown, null or blank type")
    void testGetSource_Unknown() {
        AccessLogSourceRegistry registry = registry(List.of(new CloudFrontAccessLogSource()));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> registry.getSource("akamai"));
        assertTrue(ex.getMessage().contains("cloudfront"));
        assertThrows(IllegalArgumentException.class, () -> registry.getSource(null));
        assertThrows(IllegalArgumentException.class, () -> registry.getSource(""));
    }

    @Test
    @DisplayName("Should reject two sources with the same type")
    void testInitialize_Duplicate() {
        AccessLogSourceRegistry registry = new AccessLogSourceRegistry(
                List.of(new CloudFrontAccessLogSource(), new CloudFrontAccessLogSource()));

        assertThrows(IllegalStateException.class, registry::initialize);
    }

    @Test
    @DisplayName("Should stay empty when no sources are registered")
    void testInitialize_Empty() {
        assertTrue(registry(Collections.emptyList()).getRegisteredTypes().isEmpty());
    }
}
