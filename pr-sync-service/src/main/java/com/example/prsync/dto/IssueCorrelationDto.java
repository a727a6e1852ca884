package com.example.prsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Jira correlation block for one pull request.
 * componentsMatch and assigneeMatch are tri-state: null means unknown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueCorrelationDto {

    private String jiraKey;

    @Builder.Default
    private List<String> jiraKeys = new ArrayList<>();

    private String status;
    private String summary;
    private String url;
    private LocalDateTime lastSyncedAt;

    @Builder.Default
    private List<String> components = new ArrayList<>();

    private Boolean componentsMatch;
    private String assignee;
    private Boolean assigneeMatch;

    /**
     * Keys only, every looked-up field left null.
     */
    public static IssueCorrelationDto keysOnly(List<String> keys) {
        return IssueCorrelationDto.builder()
                .jiraKey(keys.isEmpty() ? null : keys.get(0))
                .jiraKeys(new ArrayList<>(keys))
                .components(new ArrayList<>())
                .build();
    }
}
