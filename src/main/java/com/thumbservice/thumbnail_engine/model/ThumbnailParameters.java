package com.thumbservice.thumbnail_engine.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rendering options for one thumbnail. Together with the frame id these fully determine the output,
 * so they are also the input to the storage key.
 */
public record ThumbnailParameters(
    int width,
    int height,
    String labelText,
    boolean color,
    boolean median,
    double percentile,
    int quality
) {

    public static final int DEFAULT_WIDTH = 200;
    public static final int DEFAULT_HEIGHT = 200;
    public static final double DEFAULT_PERCENTILE = 99.5;
    public static final int DEFAULT_QUALITY = 80;

    public static ThumbnailParameters defaults() {
        return new ThumbnailParameters(DEFAULT_WIDTH, DEFAULT_HEIGHT, null, false, false, DEFAULT_PERCENTILE, DEFAULT_QUALITY);
    }

    /**
     * Query-string flag semantics: anything other than the literal {@code false} switches the option on.
     */
    public static boolean flagEnabled(String value) {
        return value != null && !"false".equals(value);
    }

    /**
     * Parameter name to value, using the archive-facing names. Iteration order is irrelevant;
     * {@link com.thumbservice.thumbnail_engine.util.ThumbnailKeyUtils} sorts before hashing.
     */
    public Map<String, Object> asParameterMap() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("width", width);
        params.put("height", height);
        params.put("label_text", labelText);
        params.put("color", color);
        params.put("median", median);
        params.put("percentile", percentile);
        params.put("quality", quality);
        return params;
    }
}
