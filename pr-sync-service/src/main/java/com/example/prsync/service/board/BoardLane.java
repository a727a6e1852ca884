package com.example.prsync.service.board;

/**
 * Dashboard lanes. Also the vocabulary for moving a linked Jira issue.
 */
public enum BoardLane {
    TO_REVIEW("PRs I need to review"),
    NEEDS_REVIEW("My PRs that need review"),
    REVIEWED("My PRs that have been reviewed"),
    MERGED("Merged PRs (today)");

    public static final String DRAFT_GROUP = "draft";
    public static final String NEEDS_REVIEW_GROUP = "needs-review";
    public static final String REVIEWED_GROUP = "reviewed";
    public static final String MERGED_GROUP = "merged";

    private final String title;

    BoardLane(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    /**
     * Key into {@code prsync.jira.lane-statuses} and the transition path table.
     *
     * @return null for lanes that never move an issue
     */
    public String statusGroup(boolean draft) {
        return switch (this) {
            case NEEDS_REVIEW -> draft ? DRAFT_GROUP : NEEDS_REVIEW_GROUP;
            case REVIEWED -> REVIEWED_GROUP;
            case MERGED -> MERGED_GROUP;
            case TO_REVIEW -> null;
        };
    }
}
