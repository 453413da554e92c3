package com.thumbservice.thumbnail_engine.util;

import com.thumbservice.thumbnail_engine.model.ThumbnailParameters;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Derives object storage keys for rendered thumbnails.
 *
 * <p>Keys have the form {@code {frameId}.{digest}.jpg}. The digest is a SHA-256 over the
 * parameters sorted by name, so two maps holding the same entries always produce the same key
 * no matter how they were built.</p>
 */
public final class ThumbnailKeyUtils {

    private static final String JPEG_SUFFIX = ".jpg";
    private static final String NULL_VALUE = "null";

    private ThumbnailKeyUtils() {
        // Utility class
    }

    public static String keyFor(String frameId, ThumbnailParameters parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("Thumbnail parameters cannot be null");
        }
        return keyFor(frameId, parameters.asParameterMap());
    }

    public static String keyFor(String frameId, Map<String, ?> parameters) {
        if (!ValidationUtils.hasText(frameId)) {
            throw new IllegalArgumentException("Frame id cannot be null or blank");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("Thumbnail parameters cannot be null");
        }
        return frameId + "." + digest(canonicalize(parameters)) + JPEG_SUFFIX;
    }

    /**
     * Stable string form of a parameter set: {@code name=value} pairs sorted by name, joined with {@code &}.
     */
    public static String canonicalize(Map<String, ?> parameters) {
        Map<String, String> sorted = new TreeMap<>();
        parameters.forEach((name, value) -> {
            if (name == null) {
                throw new IllegalArgumentException("Thumbnail parameter names cannot be null");
            }
            sorted.put(name, canonicalValue(value));
        });
        StringJoiner joiner = new StringJoiner("&");
        sorted.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }

    private static String canonicalValue(Object value) {
        if (value == null) {
            return NULL_VALUE;
        }
        if (value instanceof Float f) {
            return Double.toString(f.doubleValue());
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof CharSequence) {
            return value.toString();
        }
        throw new IllegalArgumentException("Unsupported thumbnail parameter type: " + value.getClass().getName());
    }

    private static String digest(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
