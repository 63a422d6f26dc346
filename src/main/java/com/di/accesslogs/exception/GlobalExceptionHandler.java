package com.di.accesslogs.exception;

import com.di.accesslogs.query.QueryExecutionFailedException;
import com.di.accesslogs.query.QueryTimeoutException;
import com.di.accesslogs.storage.ObjectStoreException;
import com.di.accesslogs.util.InvocationEventLogger;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures of the HTTP triggers to a consistent {@link ErrorResponse}.
 *
 * <p>Every handled exception is categorized with {@link ErrorCategory} and reported through
 * {@link InvocationEventLogger} as well as a plain SLF4J error line.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final InvocationEventLogger eventLogger;

    public GlobalExceptionHandler(InvocationEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    /**
     * The engine reported the statement as FAILED or CANCELLED.
     */
    @ExceptionHandler(QueryExecutionFailedException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailed(QueryExecutionFailedException e) {
        ErrorResponse body = handle("QUERY_EXCEPTION", e, HttpStatus.BAD_GATEWAY);
        body.addDetail("executionId", e.getExecutionId());
        body.addDetail("state", e.getState().name());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleQueryTimeout(QueryTimeoutException e) {
        ErrorResponse body = handle("QUERY_TIMEOUT", e, HttpStatus.GATEWAY_TIMEOUT);
        body.addDetail("executionId", e.getExecutionId());
        body.addDetail("state", e.getState().name());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body);
    }

    @ExceptionHandler(ObjectStoreException.class)
    public ResponseEntity<ErrorResponse> handleObjectStore(ObjectStoreException e) {
        ErrorResponse body = handle("STORAGE_EXCEPTION", e, HttpStatus.BAD_GATEWAY);
        body.addDetail("failedKeys", e.getFailedKeys());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    /**
     * AWS SDK client or service errors (S3, Athena submission).
     */
    @ExceptionHandler(SdkException.class)
    public ResponseEntity<ErrorResponse> handleSdkException(SdkException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(handle("AWS_SDK_EXCEPTION", e, HttpStatus.BAD_GATEWAY));
    }

    /**
     * Bad partition coordinates, an empty column list or an unreadable notification body.
     */
    @ExceptionHandler({IllegalArgumentException.class,
                      MissingServletRequestParameterException.class,
                      MethodArgumentTypeMismatchException.class,
                      MethodArgumentNotValidException.class,
                      HandlerMethodValidationException.class,
                      ConstraintViolationException.class,
                      HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(handle("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(handle("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private ErrorResponse handle(String eventType, Exception e, HttpStatus status) {
        ErrorCategory category = status == HttpStatus.BAD_REQUEST ? ErrorCategory.VALIDATION_ERROR : ErrorCategory.categorize(e);
        logError(eventType, category, e);
        return buildErrorResponse(category, e, status);
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorCategory", category.name());
        context.put("handler", "GlobalExceptionHandler");
        context.put("path", getRequestPath());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", String.valueOf(rootCause.getMessage()));
        }
        eventLogger.logEvent(eventType, context, exception);

        log.error("GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }
}
