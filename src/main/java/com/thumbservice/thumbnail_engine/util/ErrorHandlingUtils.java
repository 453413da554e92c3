/**
 * Utility class for standardized error handling across the application
 * Provides consistent classification of outbound HTTP failures
 */

package com.thumbservice.thumbnail_engine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thumbservice.thumbnail_engine.exception.ThumbnailErrorKind;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    static final String TIMEOUT_MESSAGE = "Timeout while accessing resource";
    static final String ERROR_RESPONSE_MESSAGE = "Got error response";
    static final String NOT_FOUND_MESSAGE = "Not found";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private ErrorHandlingUtils() {
    }

    /**
     * Standard error categorization for outbound calls
     */
    public enum ErrorCategory {
        TIMEOUT,
        UPSTREAM_SERVER,
        NOT_FOUND,
        CLIENT_ERROR,
        GENERAL
    }

    /**
     * Categorize an exception into standard error types
     */
    public static ErrorCategory categorizeError(Throwable throwable) {
        if (isTimeout(throwable)) {
            return ErrorCategory.TIMEOUT;
        }
        if (throwable instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            if (wcre.getStatusCode().is5xxServerError()) {
                return ErrorCategory.UPSTREAM_SERVER;
            } else if (status == 404) {
                return ErrorCategory.NOT_FOUND;
            }
            return ErrorCategory.CLIENT_ERROR;
        }
        if (throwable instanceof WebClientRequestException || throwable instanceof IOException) {
            // No response at all
            return ErrorCategory.UPSTREAM_SERVER;
        }
        if (throwable.getCause() != null && throwable.getCause() != throwable) {
            return categorizeError(throwable.getCause());
        }
        return ErrorCategory.GENERAL;
    }

    /**
     * Normalizes an outbound HTTP failure into the pipeline's error type.
     *
     * @param throwable failure raised by the WebClient call
     * @param url request URL, echoed back in timeout diagnostics
     * @param params request query parameters, echoed back in timeout diagnostics
     */
    public static ThumbnailException toThumbnailException(Throwable throwable, String url, Map<String, ?> params) {
        if (throwable instanceof ThumbnailException te) {
            return te;
        }
        ErrorCategory category = categorizeError(throwable);
        switch (category) {
            case TIMEOUT: {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("url", url);
                payload.put("params", params);
                return new ThumbnailException(ThumbnailErrorKind.UPSTREAM_TIMEOUT, TIMEOUT_MESSAGE,
                    ThumbnailErrorKind.UPSTREAM_TIMEOUT.getDefaultStatus(), payload, throwable);
            }
            case NOT_FOUND:
                return new ThumbnailException(ThumbnailErrorKind.NOT_FOUND, NOT_FOUND_MESSAGE,
                    ThumbnailErrorKind.NOT_FOUND.getDefaultStatus(), null, throwable);
            case CLIENT_ERROR: {
                WebClientResponseException wcre = findCause(throwable, WebClientResponseException.class);
                Map<String, Object> payload = new LinkedHashMap<>();
                JsonNode body = parseJsonBody(wcre);
                if (body != null) {
                    payload.put("response", body);
                }
                return new ThumbnailException(ThumbnailErrorKind.UPSTREAM_CLIENT_ERROR, ERROR_RESPONSE_MESSAGE,
                    wcre.getStatusCode().value(), payload, throwable);
            }
            case UPSTREAM_SERVER:
            default:
                return new ThumbnailException(ThumbnailErrorKind.UPSTREAM_SERVER_ERROR, ERROR_RESPONSE_MESSAGE,
                    ThumbnailErrorKind.UPSTREAM_SERVER_ERROR.getDefaultStatus(), null, throwable);
        }
    }

    static boolean isTimeout(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof TimeoutException
                || current instanceof ReadTimeoutException
                || current instanceof ConnectTimeoutException
                || current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static JsonNode parseJsonBody(WebClientResponseException wcre) {
        String body = wcre.getResponseBodyAsString();
        if (!ValidationUtils.hasText(body)) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readTree(body);
        } catch (IOException e) {
            // Body is not JSON; the status alone describes the failure
            return null;
        }
    }

    private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
        Throwable current = throwable;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        throw new IllegalStateException("Expected " + type.getSimpleName() + " in cause chain", throwable);
    }
}
