package com.example.prsync.repository;

import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.entity.PullRequestRecord;

import java.time.LocalDateTime;

/**
 * Custom repository interface for PullRequestRecord UPSERT operations.
 */
public interface PullRequestRecordRepositoryCustom {

    /**
     * Insert or fully replace the record keyed by (owner, name, number).
     * Idempotent: repeating the call with the same input leaves one row with the same fields.
     *
     * @param mine     whether the author is the tracked account
     * @param syncedAt written to last_synced_at
     * @return the managed record
     */
    PullRequestRecord upsert(PullRequestDto pullRequest,
                             IssueCorrelationDto correlation,
                             boolean mine,
                             LocalDateTime syncedAt);
}
