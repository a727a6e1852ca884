package com.example.prsync.service;

import com.example.prsync.client.external.GithubClient;
import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.dto.SyncResultDto;
import com.example.prsync.entity.SyncJob;
import com.example.prsync.metrics.SyncMetrics;
import com.example.prsync.service.signal.PullRequestMapper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One unit of a poll pass: a tracked repository or a single watched pull request.
 *
 * FLOW (sequential within the unit):
 * 1. Create sync job (transaction)
 * 2. Fetch raw nodes from GitHub (OUTSIDE transaction)
 * 3. Derive signals, filter to relevant pull requests
 * 4. Correlate with Jira (OUTSIDE transaction)
 * 5. Upsert each record (one transaction per record); a failing record is skipped for this pass
 * 6. Close sync job as COMPLETED, PARTIAL_FAILURE or FAILED
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PullRequestSyncWorker {

    private final GithubClient githubClient;
    private final PullRequestMapper pullRequestMapper;
    private final IssueCorrelator issueCorrelator;
    private final SyncDataService syncDataService;
    private final SyncMetrics syncMetrics;
    private final DegradedSyncSignal degradedSyncSignal;
    private final PrSyncProperties properties;

    @Async("syncTaskExecutor")
    public CompletableFuture<SyncResultDto> syncRepositoryAsync(PrSyncProperties.RepoRef repo) {
        return CompletableFuture.completedFuture(syncRepository(repo));
    }

    @Async("syncTaskExecutor")
    public CompletableFuture<SyncResultDto> syncWatchedAsync(PrSyncProperties.WatchedPr watched) {
        return CompletableFuture.completedFuture(syncWatched(watched));
    }

    /**
     * Sync open and merged pull requests of a tracked repository that concern the tracked account.
     */
    public SyncResultDto syncRepository(PrSyncProperties.RepoRef repo) {
        return runUnit(SyncJob.JobType.REPOSITORY_PULL_REQUESTS, repo.toString(), repo.owner(), repo.name(), true,
                () -> githubClient.fetchRepoPullRequests(repo.owner(), repo.name(), properties.github().pageSize()));
    }

    /**
     * Sync one explicitly watched pull request, regardless of author or reviewers.
     */
    public SyncResultDto syncWatched(PrSyncProperties.WatchedPr watched) {
        return runUnit(SyncJob.JobType.WATCHED_PULL_REQUEST, watched.toString(), watched.owner(), watched.name(), false,
                () -> githubClient.fetchSinglePullRequest(watched.owner(), watched.name(), watched.number())
                        .map(List::of)
                        .orElseGet(() -> {
                            log.warn("Watched pull request {} not found", watched);
                            return List.of();
                        }));
    }

    /**
     * Author is the tracked account, the tracked account is a requested reviewer,
     * or a team review is requested.
     */
    boolean isRelevant(PullRequestDto pullRequest) {
        if (properties.isTrackedAccount(pullRequest.getAuthor())) {
            return true;
        }
        if (pullRequest.getRequestedReviewers().stream().anyMatch(properties::isTrackedAccount)) {
            return true;
        }
        return !pullRequest.getRequestedReviewTeams().isEmpty();
    }

    private SyncResultDto runUnit(SyncJob.JobType jobType,
                                  String target,
                                  String owner,
                                  String name,
                                  boolean applyRelevanceFilter,
                                  Supplier<List<JsonNode>> fetch) {
        long startTime = System.currentTimeMillis();
        String correlationId = MDC.get("correlationId");
        boolean ownsCorrelationId = correlationId == null;
        if (ownsCorrelationId) {
            correlationId = "SYNC-" + UUID.randomUUID().toString().substring(0, 8);
            MDC.put("correlationId", correlationId);
        }

        SyncJob syncJob = null;
        try (DegradedSyncSignal signal = degradedSyncSignal.acquire()) {
            log.info("Starting sync for {} ({})", target, jobType);
            syncJob = syncDataService.createSyncJob(jobType, target, correlationId);

            List<JsonNode> nodes = fetch.get();
            int saved = 0;
            for (JsonNode node : nodes) {
                PullRequestDto pullRequest = null;
                try {
                    pullRequest = pullRequestMapper.toDto(owner, name, node);
                    if (applyRelevanceFilter && !isRelevant(pullRequest)) {
                        log.debug("Skipping {}#{}: not authored by or requested from tracked account",
                                target, pullRequest.getNumber());
                        continue;
                    }
                    IssueCorrelationDto correlation = issueCorrelator.correlate(pullRequest);
                    syncDataService.upsertPullRequest(pullRequest, correlation);
                    saved++;
                } catch (RuntimeException e) {
                    // Item skipped for this pass; earlier upserts stay committed
                    String item = pullRequest != null ? target + "#" + pullRequest.getNumber() : target;
                    log.warn("Skipping {} this pass: {}", item, e.getMessage(), e);
                    signal.markDegraded("Sync of " + item + " failed: " + e.getMessage());
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            boolean degraded = signal.isDegraded();
            String degradationReason = signal.getReason();

            if (degraded) {
                syncDataService.markSyncJobAsPartialFailure(syncJob.getId(), nodes.size(), saved, degradationReason);
                syncMetrics.recordSyncPartialFailure(jobType, duration);
                log.warn("Sync PARTIAL_FAILURE for {}: reason={}", target, degradationReason);
            } else {
                syncDataService.completeSyncJob(syncJob.getId(), nodes.size(), saved);
                syncMetrics.recordSyncSuccess(jobType, duration);
                log.info("Completed sync for {}: fetched={}, saved={}, duration={}ms",
                        target, nodes.size(), saved, duration);
            }

            return SyncResultDto.builder()
                    .syncJobId(syncJob.getId())
                    .target(target)
                    .jobType(jobType.name())
                    .success(true)
                    .degraded(degraded)
                    .recordsFetched(nodes.size())
                    .recordsSaved(saved)
                    .durationMs(duration)
                    .errorMessage(degradationReason)
                    .correlationId(correlationId)
                    .build();

        } catch (Exception e) {
            log.error("Failed sync for {}: {}", target, e.getMessage(), e);
            long duration = System.currentTimeMillis() - startTime;

            if (syncJob != null) {
                try {
                    syncDataService.failSyncJob(syncJob.getId(), e.getMessage());
                } catch (Exception statusError) {
                    log.error("Could not mark sync job id={} as failed: {}", syncJob.getId(), statusError.getMessage());
                }
            }
            syncMetrics.recordSyncFailure(jobType, duration);

            return SyncResultDto.builder()
                    .syncJobId(syncJob != null ? syncJob.getId() : null)
                    .target(target)
                    .jobType(jobType.name())
                    .success(false)
                    .degraded(false)
                    .errorMessage(e.getMessage())
                    .durationMs(duration)
                    .correlationId(correlationId)
                    .build();
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }
}
