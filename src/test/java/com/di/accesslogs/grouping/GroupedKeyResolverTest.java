package com.di.accesslogs.grouping;

import com.di.accesslogs.source.CloudFrontAccessLogSource;
import com.di.accesslogs.source.S3ServerAccessLogSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupedKeyResolver Tests")
class GroupedKeyResolverTest {

    private final GroupedKeyResolver cloudFront =
            new GroupedKeyResolver(new CloudFrontAccessLogSource().rawKeyPattern(), "by-date");

    @Test
    @DisplayName("Should place a CloudFront log under its logged hour")
    void testResolve_CloudFront() {
        assertEquals(
                Optional.of("by-date/year=2022/month=07/day=20/hour=13/E24DN41CDZRLM8.2022-07-20-13.d94543d0.gz"),
                cloudFront.resolve("unprocessed/E24DN41CDZRLM8.2022-07-20-13.d94543d0.gz"));
    }

    @Test
    @DisplayName("Should place an S3 server access log under its logged hour")
    void testResolve_S3ServerAccessLog() {
        GroupedKeyResolver resolver = new GroupedKeyResolver(new S3ServerAccessLogSource().rawKeyPattern(), "by-date");
        assertEquals(
                Optional.of("by-date/year=2023/month=01/day=31/hour=23/2023-01-31-23-59-12-ABCDEF0123456789"),
                resolver.resolve("unprocessed/2023-01-31-23-59-12-ABCDEF0123456789"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "unprocessed/readme.txt",
            "unprocessed/E24DN41CDZRLM8.2022-7-20-13.d94543d0.gz",
            "unprocessed/E24DN41CDZRLM8.2022-07-20.d94543d0.gz",
            ""
    })
    @DisplayName("Should not resolve keys without a date stamp")
    void testResolve_NoMatch(String key) {
        assertTrue(cloudFront.resolve(key).isEmpty());
    }

    @Test
    @DisplayName("Should not resolve a null key")
    void testResolve_Null() {
        assertTrue(cloudFront.resolve(null).isEmpty());
    }

    @Test
    @DisplayName("Should zero-pad captured fields narrower than their width")
    void testResolve_Padding() {
        Pattern loose = Pattern.compile("(?<year>\\d{1,4})/(?<month>\\d{1,2})/(?<day>\\d{1,2})/(?<hour>\\d{1,2})/");
        GroupedKeyResolver resolver = new GroupedKeyResolver(loose, "grouped");
        assertEquals(Optional.of("grouped/year=0999/month=07/day=05/hour=03/x.log"),
                resolver.resolve("logs/999/7/5/3/x.log"));
    }

    @Test
    @DisplayName("Should take the fields from the key, not from processing time")
    void testResolve_DeterministicForOldKeys() {
        assertEquals(
                Optional.of("by-date/year=2001/month=01/day=01/hour=00/DIST.2001-01-01-00.abc.gz"),
                cloudFront.resolve("unprocessed/DIST.2001-01-01-00.abc.gz"));
    }

    @Test
    @DisplayName("Should return the segment after the last slash as basename")
    void testBasename() {
        assertEquals("c.gz", GroupedKeyResolver.basename("a/b/c.gz"));
        assertEquals("c.gz", GroupedKeyResolver.basename("c.gz"));
    }
}
