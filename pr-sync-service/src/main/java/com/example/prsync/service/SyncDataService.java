package com.example.prsync.service;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.entity.SyncJob;
import com.example.prsync.metrics.SyncMetrics;
import com.example.prsync.repository.PullRequestRecordRepository;
import com.example.prsync.repository.SyncJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service for database operations with transactional boundaries.
 *
 * CRITICAL DESIGN:
 * - @Transactional methods are SHORT-LIVED
 * - NO external API calls inside these methods
 * - One transaction per pull request upsert
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncDataService {

    private final SyncJobRepository syncJobRepository;
    private final PullRequestRecordRepository pullRequestRecordRepository;
    private final PrSyncProperties properties;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    @Transactional
    public SyncJob createSyncJob(SyncJob.JobType jobType, String target, String correlationId) {
        SyncJob job = SyncJob.builder()
                .jobType(jobType)
                .target(target)
                .build();
        job.markAsStarted(correlationId, now());

        SyncJob saved = syncJobRepository.save(job);
        log.debug("Created sync job id={} for target={}, type={}", saved.getId(), target, jobType);
        return saved;
    }

    @Transactional
    public void completeSyncJob(Long syncJobId, int recordsFetched, int recordsSaved) {
        SyncJob job = findJob(syncJobId);
        job.markAsCompleted(recordsFetched, recordsSaved, now());
        syncJobRepository.save(job);

        log.info("Sync job id={} completed: fetched={}, saved={}, duration={}ms",
                syncJobId, recordsFetched, recordsSaved, job.getDurationMs());
    }

    /**
     * Pull requests stored, Jira correlation degraded for at least one of them.
     */
    @Transactional
    public void markSyncJobAsPartialFailure(Long syncJobId, int recordsFetched, int recordsSaved, String errorMessage) {
        SyncJob job = findJob(syncJobId);
        job.markAsPartialFailure(recordsFetched, recordsSaved, errorMessage, now());
        syncJobRepository.save(job);

        log.warn("Sync job id={} partial failure (degraded): fetched={}, saved={}, error={}",
                syncJobId, recordsFetched, recordsSaved, errorMessage);
    }

    @Transactional
    public void failSyncJob(Long syncJobId, String errorMessage) {
        SyncJob job = findJob(syncJobId);
        job.markAsFailed(errorMessage, now());
        syncJobRepository.save(job);

        log.error("Sync job id={} failed: {}", syncJobId, errorMessage);
    }

    /**
     * Insert or fully replace one pull request record.
     * last_synced_at is taken from the injected clock.
     */
    @Transactional
    public PullRequestRecord upsertPullRequest(PullRequestDto pullRequest, IssueCorrelationDto correlation) {
        try {
            PullRequestRecord record = pullRequestRecordRepository.upsert(
                    pullRequest, correlation, properties.isTrackedAccount(pullRequest.getAuthor()), now());
            syncMetrics.recordUpsert();
            return record;
        } catch (DataIntegrityViolationException e) {
            log.error("Data integrity violation upserting pull request {}#{}: {}",
                    pullRequest.repoFullName(), pullRequest.getNumber(), e.getMessage());
            throw e;
        }
    }

    private SyncJob findJob(Long syncJobId) {
        return syncJobRepository.findById(syncJobId)
                .orElseThrow(() -> new IllegalArgumentException("SyncJob not found: " + syncJobId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
