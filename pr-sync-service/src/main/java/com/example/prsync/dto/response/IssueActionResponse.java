package com.example.prsync.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a component or assignee fix on a linked issue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueActionResponse {

    private String issueKey;
    private boolean success;
    private boolean changed;
    private String message;

    @Builder.Default
    private List<String> components = new ArrayList<>();

    private String assignee;
}
