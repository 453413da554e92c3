package com.thumbservice.thumbnail_engine.controller.support;

import com.thumbservice.thumbnail_engine.exception.ThumbnailException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        return body;
    }

    /**
     * Payload entries of the exception followed by its message.
     */
    public static Map<String, Object> errorBody(ThumbnailException exception) {
        return exception.toBody();
    }
}
