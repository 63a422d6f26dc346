package com.di.accesslogs.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AccessLogsProperties Tests")
class AccessLogsPropertiesTest {

    private static final Set<String> TYPES = Set.of("cloudfront", "s3");

    private AccessLogsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AccessLogsProperties();
        properties.setGroupedFolder("/by-date/");
        properties.setBucket("access-logs");
        properties.getQuery().setWorkgroup("logs-workgroup");
        properties.getQuery().setDatabase("logs_database");
        properties.getQuery().setSourceTable("logs_table_by_date");
        properties.getQuery().setTargetTable("logs_table_transformed");
    }

    @Test
    @DisplayName("Should convert a complete binding into settings")
    void testToSettings_Valid() {
        AccessLogsSettings settings = properties.toSettings(TYPES);

        assertEquals("cloudfront", settings.logSource());
        assertEquals("by-date", settings.groupedFolder());
        assertEquals("transformed", settings.transformedFolder());
        assertNull(settings.rawKeyPattern());
        assertEquals(50, settings.query().maxPollAttempts());
        assertEquals(Duration.ofMillis(200), settings.query().pollDelay());
        assertTrue(settings.transformationOptions().anonymizeClientIp());
        assertTrue(settings.replaceExistingPartition());
    }

    @Test
    @DisplayName("Should list every missing key in one exception")
    void testToSettings_AllMissing() {
        AccessLogsProperties empty = new AccessLogsProperties();

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> empty.toSettings(TYPES));

        assertEquals(List.of(
                "cdnlogs.grouped-folder",
                "cdnlogs.query.workgroup",
                "cdnlogs.query.database",
                "cdnlogs.query.source-table",
                "cdnlogs.query.target-table",
                "cdnlogs.bucket"), ex.getMissingKeys());
        ex.getMissingKeys().forEach(key -> assertTrue(ex.getMessage().contains(key)));
    }

    @Test
    @DisplayName("Should not require a bucket when partitions are not replaced")
    void testToSettings_NoBucketWithoutReplace() {
        properties.setBucket(null);
        properties.getTransform().setReplaceExistingPartition(false);

        assertNull(properties.toSettings(TYPES).bucket());
    }

    @Test
    @DisplayName("Should accept a raw key pattern override with all named groups")
    void testToSettings_PatternOverride() {
        properties.setRawKeyPattern("(?<year>\\d{4})/(?<month>\\d{2})/(?<day>\\d{2})/(?<hour>\\d{2})/");

        assertNotNull(properties.toSettings(TYPES).rawKeyPattern());
    }

    @Test
    @DisplayName("Should report invalid values alongside missing keys")
    void testToSettings_Invalid() {
        properties.setLogSource("akamai");
        properties.setRawKeyPattern("(?<year>\\d{4})");
        properties.getQuery().setMaxPollAttempts(0);
        properties.getGrouping().setMaxConcurrency(0);
        properties.getGrouping().setInvocationTimeout(Duration.ZERO);
        properties.getQuery().setDatabase(" ");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> properties.toSettings(TYPES));

        assertEquals(List.of("cdnlogs.query.database"), ex.getMissingKeys());
        List<String> invalid = ex.getInvalidSettings();
        assertTrue(invalid.stream().anyMatch(s -> s.contains("log-source 'akamai'")));
        assertTrue(invalid.stream().anyMatch(s -> s.contains("lacks named group 'month'")));
        assertTrue(invalid.stream().anyMatch(s -> s.contains("max-poll-attempts")));
        assertTrue(invalid.stream().anyMatch(s -> s.contains("max-concurrency")));
        assertTrue(invalid.stream().anyMatch(s -> s.contains("invocation-timeout")));
    }

    @Test
    @DisplayName("Should report a raw key pattern that does not compile")
    void testToSettings_BrokenPattern() {
        properties.setRawKeyPattern("(?<year>\\d{4}");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> properties.toSettings(TYPES));
        assertTrue(ex.getInvalidSettings().get(0).contains("does not compile"));
    }
}
