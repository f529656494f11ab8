package com.planmarshall.core.model;

/**
 * Result of the 3-outline review gate.
 *
 * @param approved whether the deliverables were accepted
 * @param feedback reviewer feedback, required when rejected
 */
public record OutlineReview(boolean approved, String feedback) {

    public static OutlineReview approve() {
        return new OutlineReview(true, null);
    }

    public static OutlineReview reject(String feedback) {
        return new OutlineReview(false, feedback);
    }
}
