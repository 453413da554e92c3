package com.thumbservice.thumbnail_engine.exception;

/**
 * Closed set of failure kinds a thumbnail request can end in.
 * Each kind carries the HTTP status it renders as, except {@link #UPSTREAM_CLIENT_ERROR}
 * which passes the upstream status through.
 */
public enum ThumbnailErrorKind {
    VALIDATION(400),
    NOT_FOUND(404),
    UPSTREAM_TIMEOUT(504),
    UPSTREAM_SERVER_ERROR(502),
    UPSTREAM_CLIENT_ERROR(400),
    CONVERSION_FAILED(500),
    STORAGE_FAILED(500);

    private final int defaultStatus;

    ThumbnailErrorKind(int defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public int getDefaultStatus() {
        return defaultStatus;
    }
}
