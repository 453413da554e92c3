package com.thumbservice.thumbnail_engine.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure raised anywhere in the thumbnail pipeline.
 * The kind decides how the failure is rendered; the payload is optional diagnostic data
 * that is merged into the error response body next to {@code message}.
 */
public class ThumbnailException extends RuntimeException {

    private final ThumbnailErrorKind kind;
    private final int status;
    private final Map<String, Object> payload;

    public ThumbnailException(ThumbnailErrorKind kind, String message) {
        this(kind, message, kind.getDefaultStatus(), null, null);
    }

    public ThumbnailException(ThumbnailErrorKind kind, String message, Map<String, Object> payload) {
        this(kind, message, kind.getDefaultStatus(), payload, null);
    }

    public ThumbnailException(ThumbnailErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.getDefaultStatus(), null, cause);
    }

    public ThumbnailException(ThumbnailErrorKind kind, String message, int status,
                              Map<String, Object> payload, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.payload = payload == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static ThumbnailException validation(String reason) {
        return new ThumbnailException(ThumbnailErrorKind.VALIDATION, reason);
    }

    public static ThumbnailException notFound(String message) {
        return new ThumbnailException(ThumbnailErrorKind.NOT_FOUND, message);
    }

    public ThumbnailErrorKind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Response body: payload entries plus {@code message}, which always wins over a payload key of the same name.
     */
    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        body.put("message", getMessage());
        return body;
    }
}
