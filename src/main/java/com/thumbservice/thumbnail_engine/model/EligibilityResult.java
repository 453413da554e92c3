package com.thumbservice.thumbnail_engine.model;

/**
 * Outcome of checking whether a thumbnail may be generated for a frame.
 */
public record EligibilityResult(boolean eligible, String reason) {

    public static EligibilityResult ok() {
        return new EligibilityResult(true, "");
    }

    public static EligibilityResult rejected(String reason) {
        return new EligibilityResult(false, reason);
    }
}
