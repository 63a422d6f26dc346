package com.di.accesslogs.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlates the logs of one HTTP trigger. The request id is taken from the caller when it sends
 * one ({@code X-Request-Id}, or the SNS message id of a notification delivered over HTTPS) so
 * that a redelivered notification logs under the same id; otherwise one is generated.
 * <p>
 * The id is echoed in the {@code X-Request-Id} response header. Both MDC keys are removed after
 * the chain returns.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String SNS_MESSAGE_ID_HEADER = "x-amz-sns-message-id";

    private static final List<String> CORRELATION_HEADERS = List.of(REQUEST_ID_HEADER, SNS_MESSAGE_ID_HEADER);

    // Header values end up in every log line; anything else is replaced by a generated id.
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }

    static String resolveRequestId(HttpServletRequest request) {
        for (String header : CORRELATION_HEADERS) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value) && SAFE_ID.matcher(value.trim()).matches()) {
                return value.trim();
            }
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
