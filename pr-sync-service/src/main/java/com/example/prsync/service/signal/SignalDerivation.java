package com.example.prsync.service.signal;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure functions turning one raw GitHub pull request node into categorical signals.
 * No I/O; missing or malformed fields fall back to defaults.
 */
public final class SignalDerivation {

    static final String DISMISSED = "DISMISSED";
    static final int REVIEW_WINDOW = 10;

    private static final double[] SIZE_THRESHOLDS = {2, 4, 7, 11, 18};
    private static final int SPARKLINE_CAP = 2000;

    private SignalDerivation() {
    }

    /**
     * Review status over the last ten reviews.
     * APPROVED beats CHANGES_REQUESTED beats the most recent other state.
     * Dismissed reviews are ignored, but only-dismissed yields "needs re-review".
     */
    public static String reviewStatus(JsonNode node) {
        List<String> window = new ArrayList<>();
        for (JsonNode review : node.path("reviews").path("nodes")) {
            String state = text(review.path("state"));
            if (state != null && !state.isBlank()) {
                window.add(state.toUpperCase(Locale.ROOT));
            }
        }
        if (window.size() > REVIEW_WINDOW) {
            window = window.subList(window.size() - REVIEW_WINDOW, window.size());
        }

        boolean dismissedPresent = false;
        List<String> states = new ArrayList<>();
        for (String state : window) {
            if (DISMISSED.equals(state)) {
                dismissedPresent = true;
            } else {
                states.add(state);
            }
        }

        if (states.isEmpty()) {
            return dismissedPresent ? ReviewStatus.NEEDS_RE_REVIEW.label() : ReviewStatus.NEEDS_REVIEW.label();
        }
        if (states.contains(ReviewStatus.APPROVED.name())) {
            return ReviewStatus.APPROVED.label();
        }
        if (states.contains(ReviewStatus.CHANGES_REQUESTED.name())) {
            return ReviewStatus.CHANGES_REQUESTED.label();
        }
        String latest = states.get(states.size() - 1);
        return ReviewStatus.fromState(latest)
                .map(ReviewStatus::label)
                .orElse(latest.toLowerCase(Locale.ROOT));
    }

    public static String ciSummary(JsonNode node) {
        JsonNode commits = node.path("commitsWithStatus").path("nodes");
        if (!commits.isArray() || commits.isEmpty()) {
            return "no commits";
        }
        return summariseRollup(commits.get(0).path("commit").path("statusCheckRollup"), "checks");
    }

    /**
     * @return null when the pull request has no merge commit
     */
    public static String mergeCiSummary(JsonNode node) {
        JsonNode mergeCommit = node.path("mergeCommit");
        if (!mergeCommit.isObject()) {
            return null;
        }
        return summariseRollup(mergeCommit.path("statusCheckRollup"), "merge checks");
    }

    public static boolean hasConflicts(JsonNode node) {
        String mergeState = text(node.path("mergeStateStatus"));
        return mergeState != null && mergeState.toUpperCase(Locale.ROOT).equals("DIRTY");
    }

    public static int sizeTier(JsonNode node) {
        int churn = intValue(node.path("additions")) + intValue(node.path("deletions"));
        int commits = intValue(node.path("commitTotals").path("totalCount"));
        if (commits == 0) {
            commits = intValue(node.path("commits").path("totalCount"));
        }
        return sizeTier(churn, intValue(node.path("changedFiles")), commits);
    }

    /**
     * score = churn * 0.01 + files * 0.2 + commits * 0.05, bucketed into
     * [0,2) [2,4) [4,7) [7,11) [11,18) [18,inf).
     */
    public static int sizeTier(int churn, int files, int commits) {
        double score = churn * 0.01 + files * 0.2 + commits * 0.05;
        int tier = 0;
        for (double threshold : SIZE_THRESHOLDS) {
            if (score < threshold) {
                break;
            }
            tier++;
        }
        return tier;
    }

    /**
     * Ten rising values scaled by min(churn + files * 20, 2000) / 2000.
     */
    public static List<Double> sizeSparkline(JsonNode node) {
        int churn = intValue(node.path("additions")) + intValue(node.path("deletions"));
        int files = intValue(node.path("changedFiles"));
        double norm = Math.min(churn + files * 20, SPARKLINE_CAP) / (double) SPARKLINE_CAP;

        List<Double> values = new ArrayList<>(10);
        for (int i = 1; i <= 10; i++) {
            values.add(norm * (i / 10.0));
        }
        return values;
    }

    private static String summariseRollup(JsonNode rollup, String label) {
        if (!rollup.isObject()) {
            return "no " + label;
        }
        String state = text(rollup.path("state"));
        if (state == null || state.isBlank()) {
            state = "UNKNOWN";
        }
        JsonNode contexts = rollup.path("contexts").path("nodes");
        int count = contexts.isArray() ? contexts.size() : 0;
        return state + " (" + count + " " + label + ")";
    }

    static String text(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static int intValue(JsonNode node) {
        return node != null && node.canConvertToInt() ? node.asInt() : 0;
    }
}
