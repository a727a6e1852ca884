package com.example.prsync.dto.response;

import com.example.prsync.entity.PullRequestRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestResponse {

    private String owner;
    private String repo;
    private int number;
    private String title;
    private String author;
    private String url;
    private String state;
    private boolean draft;
    private boolean mine;
    private String reviewStatus;
    private String ciSummary;
    private String mergeCiSummary;
    private boolean hasConflicts;
    private int sizeTier;
    private LocalDateTime updatedAt;
    private LocalDateTime mergedAt;
    private LocalDateTime lastSyncedAt;
    private String jiraKey;
    private List<String> jiraKeys;
    private String jiraStatus;
    private String jiraSummary;
    private String jiraUrl;
    private List<String> jiraComponents;
    private Boolean jiraComponentsMatch;
    private String jiraAssignee;
    private Boolean jiraAssigneeMatch;

    public static PullRequestResponse from(PullRequestRecord record) {
        return PullRequestResponse.builder()
                .owner(record.getRepoOwner())
                .repo(record.getRepoName())
                .number(record.getNumber())
                .title(record.getTitle())
                .author(record.getAuthor())
                .url(record.getUrl())
                .state(record.getState() != null ? record.getState().name() : null)
                .draft(record.isDraft())
                .mine(record.isMine())
                .reviewStatus(record.getReviewStatus())
                .ciSummary(record.getCiSummary())
                .mergeCiSummary(record.getMergeCiSummary())
                .hasConflicts(record.isHasConflicts())
                .sizeTier(record.getSizeTier())
                .updatedAt(record.getUpdatedAt())
                .mergedAt(record.getMergedAt())
                .lastSyncedAt(record.getLastSyncedAt())
                .jiraKey(record.getJiraKey())
                .jiraKeys(record.getJiraKeys())
                .jiraStatus(record.getJiraStatus())
                .jiraSummary(record.getJiraSummary())
                .jiraUrl(record.getJiraUrl())
                .jiraComponents(record.getJiraComponents())
                .jiraComponentsMatch(record.getJiraComponentsMatch())
                .jiraAssignee(record.getJiraAssignee())
                .jiraAssigneeMatch(record.getJiraAssigneeMatch())
                .build();
    }
}
