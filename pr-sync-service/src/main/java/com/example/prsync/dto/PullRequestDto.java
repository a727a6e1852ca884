package com.example.prsync.dto;

import com.example.prsync.entity.PullRequestState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One pull request after signal derivation, ready for correlation and upsert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestDto {

    private String owner;
    private String name;
    private int number;
    private String title;
    private String author;
    private String url;
    private String headRefName;
    private String body;
    private PullRequestState state;
    private boolean draft;
    private String reviewStatus;
    private String ciSummary;
    private String mergeCiSummary;
    private String lastCommitSha;
    private String mergeCommitSha;
    private boolean hasConflicts;
    private int sizeTier;
    private LocalDateTime updatedAt;
    private LocalDateTime mergedAt;

    /** GraphQL node as received, plus size_sparkline. */
    private Map<String, Object> raw;

    @Builder.Default
    private List<String> requestedReviewers = new ArrayList<>();

    @Builder.Default
    private List<String> requestedReviewTeams = new ArrayList<>();

    @Builder.Default
    private List<String> issueKeys = new ArrayList<>();

    public String repoFullName() {
        return owner + "/" + name;
    }
}
