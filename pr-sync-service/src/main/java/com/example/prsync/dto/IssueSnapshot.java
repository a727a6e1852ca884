package com.example.prsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time view of a Jira issue, as returned by {@code GET /rest/api/3/issue/{key}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueSnapshot {

    public static final String NOT_FOUND_STATUS = "not found";

    private String key;
    private String status;
    private String summary;
    private String url;

    @Builder.Default
    private List<String> components = new ArrayList<>();

    private Assignee assignee;

    @Builder.Default
    private boolean found = true;

    public static IssueSnapshot notFound(String key, String url) {
        return IssueSnapshot.builder()
                .key(key)
                .status(NOT_FOUND_STATUS)
                .url(url)
                .found(false)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Assignee {
        private String displayName;
        private String emailAddress;
        private String accountId;
    }
}
