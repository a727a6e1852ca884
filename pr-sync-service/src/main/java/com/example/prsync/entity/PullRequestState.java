package com.example.prsync.entity;

/**
 * Pull request lifecycle state as reported by GitHub.
 */
public enum PullRequestState {
    OPEN,
    CLOSED,
    MERGED;

    /**
     * Lenient parse; unknown or missing values are treated as OPEN.
     */
    public static PullRequestState fromRemote(String value) {
        if (value == null) {
            return OPEN;
        }
        try {
            return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OPEN;
        }
    }
}
