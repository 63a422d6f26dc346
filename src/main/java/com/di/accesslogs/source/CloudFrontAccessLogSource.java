package com.di.accesslogs.source;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * CloudFront standard access logs.
 *
 * <p>Key format: {@code {prefix/}{distribution_id}.{year}-{month}-{day}-{hour}.{random_id}.gz},
 * e.g. {@code unprocessed/E24DN41CDZRLM8.2022-07-20-13.d94543d0.gz}. CloudFront appends the slash
 * after the prefix itself.
 */
@Component
public class CloudFrontAccessLogSource implements AccessLogSource {

    public static final String TYPE = "cloudfront";

    static final String UNPROCESSED_PREFIX = "unprocessed/";

    private static final Pattern RAW_KEY_PATTERN = Pattern.compile(
            "[\\w/]+\\.(?<year>\\d{4})-(?<month>\\d{2})-(?<day>\\d{2})-(?<hour>\\d{2})\\.\\w+\\.gz");

    static final String ANONYMIZE_IP_EXPRESSION = "regexp_replace(request_ip, '(.*\\.|:).*', '$1xxx')";

    private static final TableSchema SCHEMA = TableSchema.hourly(List.of(
            TableColumn.of("date", "date"),
            TableColumn.string("time"),
            TableColumn.string("location"),
            TableColumn.of("bytes", "bigint"),
            TableColumn.string("request_ip"),
            TableColumn.string("method"),
            TableColumn.string("host"),
            TableColumn.string("uri"),
            TableColumn.of("status", "int"),
            TableColumn.string("referrer"),
            TableColumn.string("user_agent"),
            TableColumn.string("query_string"),
            TableColumn.string("cookie"),
            TableColumn.string("result_type"),
            TableColumn.string("request_id"),
            TableColumn.string("host_header"),
            TableColumn.string("request_protocol"),
            TableColumn.of("request_bytes", "bigint"),
            TableColumn.of("time_taken", "float"),
            TableColumn.string("xforwarded_for"),
            TableColumn.string("ssl_protocol"),
            TableColumn.string("ssl_cipher"),
            TableColumn.string("response_result_type"),
            TableColumn.string("http_version"),
            TableColumn.string("fle_status"),
            TableColumn.of("fle_encrypted_fields", "int"),
            TableColumn.of("c_port", "int"),
            TableColumn.of("time_to_first_byte", "float"),
            TableColumn.string("x_edge_detailed_result_type"),
            TableColumn.string("sc_content_type"),
            TableColumn.of("sc_content_len", "bigint"),
            TableColumn.of("sc_range_start", "bigint"),
            TableColumn.of("sc_range_end", "bigint")));

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Pattern rawKeyPattern() {
        return RAW_KEY_PATTERN;
    }

    @Override
    public ObjectKeyFilter unprocessedObjectsFilter() {
        return new ObjectKeyFilter(UNPROCESSED_PREFIX, ".gz");
    }

    @Override
    public TableSchema tableSchema() {
        return SCHEMA;
    }

    /**
     * <ul>
     *   <li>{@code request_ip}: last IPv4 octet / IPv6 group replaced by {@code xxx}</li>
     *   <li>{@code cookie}: only whitelisted cookies kept, {@code %2522} decoded to a quote</li>
     * </ul>
     */
    @Override
    public ColumnTransformationRules columnTransformationRules(TransformationOptions options) {
        Map<String, String> rules = new LinkedHashMap<>();
        if (options.anonymizeClientIp()) {
            rules.put("request_ip", ANONYMIZE_IP_EXPRESSION);
        }
        if (!options.cookieWhitelist().isEmpty()) {
            rules.put("cookie", cookieWhitelistExpression(options.cookieWhitelist()));
        }
        return ColumnTransformationRules.of(rules);
    }

    static String cookieWhitelistExpression(List<String> cookies) {
        return "replace( array_join( regexp_extract_all( cookie, '("
                + String.join("|", cookies)
                + ")=[^;]+' ), ';' ), '%2522', '\"' )";
    }
}
