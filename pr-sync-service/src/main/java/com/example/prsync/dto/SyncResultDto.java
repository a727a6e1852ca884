package com.example.prsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one unit of work (a tracked repository or a watched pull request).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResultDto {

    private Long syncJobId;
    private String target;
    private String jobType;
    private boolean success;
    private boolean degraded;  // pull requests stored, Jira lookups failed
    private int recordsFetched;
    private int recordsSaved;
    private long durationMs;
    private String errorMessage;
    private String correlationId;
}
