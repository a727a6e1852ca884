package com.example.prsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one resolver run. Applied steps are never rolled back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionOutcome {

    private boolean success;
    private String issueKey;

    @Builder.Default
    private List<String> targetStatuses = new ArrayList<>();

    @Builder.Default
    private List<TransitionStep> appliedSteps = new ArrayList<>();

    private String finalStatus;
    private String failureReason;

    @Builder.Default
    private List<TransitionPathStep> candidates = new ArrayList<>();

    /**
     * The run failed after moving the issue at least once.
     */
    public boolean isPartialProgress() {
        return !success && !appliedSteps.isEmpty();
    }
}
