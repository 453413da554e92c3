package com.thumbservice.thumbnail_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound calls made while serving a thumbnail:
 * - archive metadata API (frame lookups, sibling frame listings)
 * - raw frame downloads
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url, boolean authenticated) {
        String authType = authenticated ? "AUTHENTICATED" : "UNAUTHENTICATED";
        log.info("{} [HTTP] {} {} request to: {}", PREFIX, authType, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url, long bodySize) {
        log.info("{} [HTTP] Response: status={}, url={}, bodySize={} bytes", PREFIX, statusCode, url, bodySize);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String url, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for url='{}' - {}", PREFIX, apiName, operation, url, reason);
    }
}
