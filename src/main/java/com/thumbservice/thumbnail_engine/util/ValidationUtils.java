package com.thumbservice.thumbnail_engine.util;

import java.util.Collection;
import java.util.Locale;

/**
 * Utility helpers for common null/blank/empty validation checks.
 */
public final class ValidationUtils {
    private ValidationUtils() {
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static boolean isEmpty(Collection<?> collection) {
        return collection == null || collection.isEmpty();
    }

    public static String upperCaseOrEmpty(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean endsWithAny(String value, Collection<String> suffixes) {
        if (value == null || isEmpty(suffixes)) {
            return false;
        }
        for (String suffix : suffixes) {
            if (suffix != null && value.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
