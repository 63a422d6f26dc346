package com.di.accesslogs.partition;

import com.di.accesslogs.source.ColumnTransformationRules;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SelectListBuilder Tests")
class SelectListBuilderTest {

    @Test
    @DisplayName("Should alias overridden columns and keep others bare, in order")
    void testBuild_OverrideAndPassThrough() {
        ColumnTransformationRules rules = ColumnTransformationRules.of(
                Map.of("request_ip", "regexp_replace(request_ip,'(.*\\.|:).*','$1xxx')"));

        assertEquals("regexp_replace(request_ip,'(.*\\.|:).*','$1xxx') AS request_ip, status",
                SelectListBuilder.build(List.of("request_ip", "status"), rules));
    }

    @Test
    @DisplayName("Should emit bare columns without rules")
    void testBuild_NoRules() {
        assertEquals("a, b, c", SelectListBuilder.build(List.of("a", "b", "c"), ColumnTransformationRules.none()));
    }

    @Test
    @DisplayName("Should treat blank and null expressions as pass-through")
    void testBuild_BlankExpression() {
        Map<String, String> raw = new HashMap<>();
        raw.put("cookie", "  ");
        raw.put("uri", null);
        assertEquals("cookie, uri", SelectListBuilder.build(List.of("cookie", "uri"), ColumnTransformationRules.of(raw)));
    }

    @Test
    @DisplayName("Should ignore rules for columns not in the output list")
    void testBuild_UnusedRule() {
        ColumnTransformationRules rules = ColumnTransformationRules.of(Map.of("remoteip", "'x'"));
        assertEquals("status", SelectListBuilder.build(List.of("status"), rules));
    }
}
