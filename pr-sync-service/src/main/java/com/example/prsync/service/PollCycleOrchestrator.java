package com.example.prsync.service;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.PollCycleResultDto;
import com.example.prsync.dto.SyncResultDto;
import com.example.prsync.metrics.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs one poll pass: fans the tracked repositories and watched pull requests out to the
 * bounded sync executor and waits for all of them.
 *
 * Units are independent; a failing or rejected unit never stops the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollCycleOrchestrator {

    private final PrSyncProperties properties;
    private final PullRequestSyncWorker pullRequestSyncWorker;
    private final SyncMetrics syncMetrics;

    public PollCycleResultDto runPass() {
        String correlationId = MDC.get("correlationId");
        boolean ownsCorrelationId = correlationId == null;
        if (ownsCorrelationId) {
            correlationId = "POLL-" + UUID.randomUUID().toString().substring(0, 8);
            MDC.put("correlationId", correlationId);
        }

        try {
            List<PrSyncProperties.RepoRef> repos = properties.repoList();
            List<PrSyncProperties.WatchedPr> watched = properties.watchedPrList();
            log.info("Starting poll pass: repos={}, watched={}", repos.size(), watched.size());

            List<CompletableFuture<SyncResultDto>> futures = new ArrayList<>();
            int rejected = 0;
            for (PrSyncProperties.RepoRef repo : repos) {
                if (submit(futures, () -> pullRequestSyncWorker.syncRepositoryAsync(repo), repo.toString())) {
                    rejected++;
                }
            }
            for (PrSyncProperties.WatchedPr pr : watched) {
                if (submit(futures, () -> pullRequestSyncWorker.syncWatchedAsync(pr), pr.toString())) {
                    rejected++;
                }
            }

            List<SyncResultDto> results = new ArrayList<>();
            for (CompletableFuture<SyncResultDto> future : futures) {
                results.add(future
                        .exceptionally(ex -> {
                            log.error("Sync unit completed exceptionally: {}", ex.getMessage());
                            return SyncResultDto.builder().success(false).errorMessage(ex.getMessage()).build();
                        })
                        .join());
            }

            PollCycleResultDto result = PollCycleResultDto.builder()
                    .correlationId(correlationId)
                    .results(results)
                    .rejected(rejected)
                    .build();

            if (rejected > 0) {
                log.warn("Poll pass partial rejection: {}/{} units rejected", rejected, repos.size() + watched.size());
            }
            log.info("Completed poll pass: units={}, failed={}, degraded={}, rejected={}",
                    results.size(), result.failedCount(), result.degradedCount(), rejected);
            return result;
        } finally {
            if (ownsCorrelationId) {
                MDC.remove("correlationId");
            }
        }
    }

    /**
     * @return true if the executor rejected the unit
     */
    private boolean submit(List<CompletableFuture<SyncResultDto>> futures,
                           Supplier<CompletableFuture<SyncResultDto>> task,
                           String target) {
        try {
            futures.add(task.get());
            return false;
        } catch (RejectedExecutionException e) {
            log.error("Sync queue full, unit rejected for {}. Exception type: {}",
                    target, e.getClass().getSimpleName());
            syncMetrics.recordSyncRejection();
            return true;
        }
    }
}
