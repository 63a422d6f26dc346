package com.di.accesslogs.exception;

import com.di.accesslogs.config.ConfigurationException;
import com.di.accesslogs.query.QueryExecutionFailedException;
import com.di.accesslogs.query.QueryTimeoutException;
import com.di.accesslogs.storage.ObjectStoreException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for invocation event logging and alerting.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    QUERY_FAILED("Query failed", "The query engine reported the statement as failed or cancelled"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    AUTHENTICATION_ERROR("Authentication error", "Authentication or authorization failure"),
    STORAGE_ERROR("Storage error", "Object storage request failed"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof QueryExecutionFailedException, QUERY_FAILED);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isStorageError, STORAGE_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof ConfigurationException
                || t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof QueryTimeoutException
                || t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isAuthenticationError(Throwable t) {
        if (t instanceof SdkServiceException) {
            int status = ((SdkServiceException) t).statusCode();
            if (status == 401 || status == 403) {
                return true;
            }
        }
        return messageContains(t, "access denied", "unauthorized", "forbidden", "expired token", "invalid credentials");
    }

    private static boolean isStorageError(Throwable t) {
        return t instanceof ObjectStoreException
                || t instanceof software.amazon.awssdk.services.s3.model.S3Exception;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof SdkClientException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof SdkException && ((SdkException) t).retryable());
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean messageContains(Throwable t, String... fragments) {
        String msg = t.getMessage();
        if (msg == null) {
            return false;
        }
        String lower = msg.toLowerCase();
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
