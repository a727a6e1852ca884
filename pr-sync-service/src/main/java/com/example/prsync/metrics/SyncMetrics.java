package com.example.prsync.metrics;

import com.example.prsync.entity.SyncJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - sync_jobs_total: Counter of sync units by job type and status
 * - sync_duration_seconds: Timer for sync unit duration
 * - pull_requests_upserted_total: Records written to the store
 * - jira_lookup_failures_total: Issue lookups that failed during correlation
 * - jira_transitions_applied_total: Transitions applied by the resolver
 * - parser_warning_count: Tracks timestamp parsing failures
 * - sync_tasks_rejected_total: Units rejected by the bounded executor
 *
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter pullRequestsUpsertedCounter;
    private final Counter jiraLookupFailureCounter;
    private final Counter jiraTransitionsAppliedCounter;
    private final Counter parserWarningCounter;
    private final Counter syncTasksRejectedCounter;

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.pullRequestsUpsertedCounter = Counter.builder("pull_requests_upserted_total")
                .description("Number of pull request records inserted or replaced")
                .register(meterRegistry);

        this.jiraLookupFailureCounter = Counter.builder("jira_lookup_failures_total")
                .description("Number of Jira issue lookups that failed during correlation")
                .register(meterRegistry);

        this.jiraTransitionsAppliedCounter = Counter.builder("jira_transitions_applied_total")
                .description("Number of Jira workflow transitions applied")
                .register(meterRegistry);

        this.parserWarningCounter = Counter.builder("parser_warning_count")
                .description("Number of timestamp parsing failures")
                .register(meterRegistry);

        this.syncTasksRejectedCounter = Counter.builder("sync_tasks_rejected_total")
                .description("Number of sync tasks rejected due to queue full (AbortPolicy)")
                .register(meterRegistry);
    }

    public void recordSyncSuccess(SyncJob.JobType jobType, long durationMs) {
        recordOutcome(jobType, "success", durationMs);
        log.debug("Recorded sync success: jobType={}, duration={}ms", jobType, durationMs);
    }

    /**
     * Pull requests stored, but at least one Jira lookup failed.
     */
    public void recordSyncPartialFailure(SyncJob.JobType jobType, long durationMs) {
        recordOutcome(jobType, "partial_failure", durationMs);
        log.warn("Recorded sync partial failure (degraded): jobType={}, duration={}ms", jobType, durationMs);
    }

    public void recordSyncFailure(SyncJob.JobType jobType, long durationMs) {
        recordOutcome(jobType, "failure", durationMs);
        log.debug("Recorded sync failure: jobType={}", jobType);
    }

    public void recordUpsert() {
        pullRequestsUpsertedCounter.increment();
    }

    public void recordJiraLookupFailure() {
        jiraLookupFailureCounter.increment();
    }

    public void recordTransitionApplied() {
        jiraTransitionsAppliedCounter.increment();
    }

    /**
     * Called when a remote timestamp cannot be parsed and the fallback is used.
     * The call site logs the field and raw value.
     */
    public void recordParserWarning() {
        parserWarningCounter.increment();
    }

    /**
     * Called when RejectedExecutionException is thrown by AbortPolicy.
     */
    public void recordSyncRejection() {
        syncTasksRejectedCounter.increment();
        log.error("Sync task rejected - queue full (capacity exhausted)");
    }

    private void recordOutcome(SyncJob.JobType jobType, String status, long durationMs) {
        String type = jobType.name().toLowerCase();
        Counter.builder("sync_jobs_total")
                .description("Total number of sync jobs")
                .tag("job_type", type)
                .tag("status", status)
                .register(meterRegistry)
                .increment();
        Timer.builder("sync_duration_seconds")
                .description("Duration of sync operations")
                .tag("job_type", type)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
