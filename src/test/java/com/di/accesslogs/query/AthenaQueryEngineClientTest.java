package com.di.accesslogs.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("AthenaQueryEngineClient Tests")
class AthenaQueryEngineClientTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "QUEUED, RUNNING",
            "RUNNING, RUNNING",
            "SUCCEEDED, SUCCEEDED",
            "FAILED, FAILED",
            "CANCELLED, CANCELLED",
            "UNKNOWN_TO_SDK_VERSION, RUNNING"
    })
    @DisplayName("Should map Athena states onto execution states")
    void testMap(software.amazon.awssdk.services.athena.model.QueryExecutionState athena, QueryExecutionState expected) {
        assertEquals(expected, AthenaQueryEngineClient.map(athena));
    }
}
