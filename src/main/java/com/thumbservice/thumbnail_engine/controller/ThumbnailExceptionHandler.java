package com.thumbservice.thumbnail_engine.controller;

import com.thumbservice.thumbnail_engine.controller.support.ErrorResponseUtils;
import com.thumbservice.thumbnail_engine.exception.ThumbnailException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Renders every failure of a thumbnail request as a JSON body with a {@code message} field.
 */
@RestControllerAdvice
@Slf4j
public class ThumbnailExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    @ExceptionHandler(ThumbnailException.class)
    public ResponseEntity<Map<String, Object>> handleThumbnailException(ThumbnailException ex) {
        switch (ex.getKind()) {
            case VALIDATION, NOT_FOUND, UPSTREAM_CLIENT_ERROR ->
                log.info("Thumbnail request rejected ({}): {}", ex.getStatus(), ex.getMessage());
            case UPSTREAM_TIMEOUT, UPSTREAM_SERVER_ERROR ->
                log.warn("Archive unavailable ({}): {}", ex.getStatus(), ex.getMessage());
            case CONVERSION_FAILED, STORAGE_FAILED ->
                log.error("Thumbnail generation failed ({}): {}", ex.getKind(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(ex.getStatus()).body(ErrorResponseUtils.errorBody(ex));
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        log.info("Invalid request parameter: {}", ex.getMessage());
        String message = ex instanceof MethodArgumentTypeMismatchException mismatch
            ? "Invalid value for parameter " + mismatch.getName()
            : "Invalid request parameter";
        return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody(message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework-level rejections such as an unsupported method keep their own status
            HttpStatusCode status = errorResponse.getStatusCode();
            log.info("Request rejected by framework ({}): {}", status.value(), ex.getMessage());
            String reason = status instanceof HttpStatus known ? known.getReasonPhrase() : "Request failed";
            return ResponseEntity.status(status).body(ErrorResponseUtils.errorBody(reason));
        }
        log.error("Unexpected error while serving thumbnail: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponseUtils.errorBody(INTERNAL_ERROR_MESSAGE));
    }
}
