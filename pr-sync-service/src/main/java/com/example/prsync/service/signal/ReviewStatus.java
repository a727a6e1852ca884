package com.example.prsync.service.signal;

import java.util.Locale;
import java.util.Optional;

/**
 * Review status labels stored on the record.
 */
public enum ReviewStatus {
    NEEDS_REVIEW("needs review"),
    NEEDS_RE_REVIEW("needs re-review"),
    APPROVED("approved"),
    CHANGES_REQUESTED("changes requested"),
    COMMENTED("commented"),
    PENDING("pending");

    private final String label;

    ReviewStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Look up a raw GitHub review state such as {@code COMMENTED}.
     */
    public static Optional<ReviewStatus> fromState(String state) {
        if (state == null) {
            return Optional.empty();
        }
        String normalized = state.trim().toUpperCase(Locale.ROOT);
        for (ReviewStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    /**
     * Labels that put one of my pull requests in the "reviewed" lane.
     * "reviewed" is accepted for records written before labels were fixed.
     */
    public static boolean isReviewedLabel(String label) {
        if (label == null) {
            return false;
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        return normalized.equals(APPROVED.label)
                || normalized.equals(CHANGES_REQUESTED.label)
                || normalized.equals("reviewed");
    }
}
