package com.di.accesslogs.source;

import java.util.List;

/**
 * Deployment choices that shape a source's column transformation rules.
 *
 * @param anonymizeClientIp replace the last IPv4 octet / IPv6 group of the client address with {@code xxx}
 * @param cookieWhitelist   cookie names kept in the {@code cookie} column; empty keeps the column as is
 */
public record TransformationOptions(boolean anonymizeClientIp, List<String> cookieWhitelist) {

    public TransformationOptions {
        cookieWhitelist = cookieWhitelist == null ? List.of() : List.copyOf(cookieWhitelist);
    }

    public static TransformationOptions defaults() {
        return new TransformationOptions(true, List.of());
    }
}
