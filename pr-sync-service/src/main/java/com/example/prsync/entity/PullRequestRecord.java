package com.example.prsync.entity;

import com.example.prsync.entity.converter.JsonMapConverter;
import com.example.prsync.entity.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canonical local record of one pull request, unique on (repo_owner, repo_name, number).
 *
 * Every remote, derived and correlated column is overwritten on each sync; nothing is merged.
 * raw_snapshot keeps the GraphQL node as received (plus size_sparkline) for display and audit.
 */
@Entity
@Table(name = "pull_requests",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_pull_requests_repo_number",
                        columnNames = {"repo_owner", "repo_name", "number"})
        },
        indexes = {
                @Index(name = "idx_pull_requests_author", columnList = "author"),
                @Index(name = "idx_pull_requests_state_merged_at", columnList = "state,merged_at")
        })
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PullRequestRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repo_owner", nullable = false, updatable = false)
    private String repoOwner;

    @Column(name = "repo_name", nullable = false, updatable = false)
    private String repoName;

    @Column(name = "number", nullable = false, updatable = false)
    private Integer number;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "author", nullable = false)
    private String author;

    @Column(name = "url", length = 1000)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private PullRequestState state;

    @Column(name = "is_draft", nullable = false)
    private boolean draft;

    @Column(name = "review_status", length = 50)
    private String reviewStatus;

    @Column(name = "ci_summary")
    private String ciSummary;

    @Column(name = "merge_ci_summary")
    private String mergeCiSummary;

    @Column(name = "last_commit_sha", length = 64)
    private String lastCommitSha;

    @Column(name = "merge_commit_sha", length = 64)
    private String mergeCommitSha;

    @Column(name = "has_conflicts", nullable = false)
    private boolean hasConflicts;

    @Column(name = "size_tier", nullable = false)
    private int sizeTier;

    @Column(name = "is_mine", nullable = false)
    private boolean mine;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "merged_at")
    private LocalDateTime mergedAt;

    @Column(name = "last_synced_at", nullable = false)
    private LocalDateTime lastSyncedAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "raw_snapshot", columnDefinition = "TEXT")
    private Map<String, Object> rawSnapshot;

    // Jira correlation

    @Column(name = "jira_key", length = 50)
    private String jiraKey;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "jira_keys", columnDefinition = "TEXT")
    private List<String> jiraKeys = new ArrayList<>();

    @Column(name = "jira_status", length = 100)
    private String jiraStatus;

    @Column(name = "jira_summary", length = 1000)
    private String jiraSummary;

    @Column(name = "jira_url", length = 1000)
    private String jiraUrl;

    @Column(name = "jira_last_synced_at")
    private LocalDateTime jiraLastSyncedAt;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "jira_components", columnDefinition = "TEXT")
    private List<String> jiraComponents = new ArrayList<>();

    /** null = unknown (issue has no components) */
    @Column(name = "jira_components_match")
    private Boolean jiraComponentsMatch;

    @Column(name = "jira_assignee")
    private String jiraAssignee;

    /** null = unknown (no identity configured to compare against) */
    @Column(name = "jira_assignee_match")
    private Boolean jiraAssigneeMatch;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean isLinkedTo(String issueKey) {
        if (issueKey == null) {
            return false;
        }
        if (issueKey.equalsIgnoreCase(jiraKey)) {
            return true;
        }
        return jiraKeys != null && jiraKeys.stream().anyMatch(issueKey::equalsIgnoreCase);
    }
}
