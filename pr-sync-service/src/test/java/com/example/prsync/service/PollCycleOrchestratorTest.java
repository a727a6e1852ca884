package com.example.prsync.service;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.PollCycleResultDto;
import com.example.prsync.dto.SyncResultDto;
import com.example.prsync.metrics.SyncMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PollCycleOrchestratorTest {

    private PullRequestSyncWorker worker;
    private SimpleMeterRegistry meterRegistry;
    private PollCycleOrchestrator orchestrator;

    private final PrSyncProperties.RepoRef web = new PrSyncProperties.RepoRef("acme", "web");
    private final PrSyncProperties.RepoRef api = new PrSyncProperties.RepoRef("acme", "api");
    private final PrSyncProperties.WatchedPr watched = new PrSyncProperties.WatchedPr("other", "lib", 5);

    @BeforeEach
    void setUp() {
        worker = mock(PullRequestSyncWorker.class);
        meterRegistry = new SimpleMeterRegistry();
        PrSyncProperties properties = new PrSyncProperties(null, null,
                new PrSyncProperties.Poll(null, List.of("acme/web", " acme/api ", ""), List.of("other/lib#5")), null);
        orchestrator = new PollCycleOrchestrator(properties, worker, new SyncMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void runPass_SubmitsEveryUnitAndCollectsResults() {
        when(worker.syncRepositoryAsync(web)).thenReturn(done("acme/web", true, false));
        when(worker.syncRepositoryAsync(api)).thenReturn(done("acme/api", true, true));
        when(worker.syncWatchedAsync(watched)).thenReturn(done("other/lib#5", false, false));

        PollCycleResultDto result = orchestrator.runPass();

        assertThat(result.getResults()).extracting(SyncResultDto::getTarget)
                .containsExactly("acme/web", "acme/api", "other/lib#5");
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.degradedCount()).isEqualTo(1);
        assertThat(result.getRejected()).isZero();
        assertThat(result.getCorrelationId()).startsWith("POLL-");
        assertThat(MDC.get("correlationId")).isNull();
    }

    @Test
    void runPass_RejectedUnitDoesNotStopOthers() {
        when(worker.syncRepositoryAsync(web)).thenThrow(new RejectedExecutionException("queue full"));
        when(worker.syncRepositoryAsync(api)).thenReturn(done("acme/api", true, false));
        when(worker.syncWatchedAsync(watched)).thenReturn(done("other/lib#5", true, false));

        PollCycleResultDto result = orchestrator.runPass();

        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(result.getResults()).hasSize(2);
        assertThat(meterRegistry.counter("sync_tasks_rejected_total").count()).isEqualTo(1.0);
        verify(worker).syncWatchedAsync(watched);
    }

    @Test
    void runPass_ExceptionalUnitBecomesFailedResult() {
        when(worker.syncRepositoryAsync(web)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        when(worker.syncRepositoryAsync(api)).thenReturn(done("acme/api", true, false));
        when(worker.syncWatchedAsync(watched)).thenReturn(done("other/lib#5", true, false));

        PollCycleResultDto result = orchestrator.runPass();

        assertThat(result.getResults()).hasSize(3);
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.getResults().get(0).getErrorMessage()).contains("boom");
    }

    @Test
    void runPass_UsesCallerCorrelationId() {
        MDC.put("correlationId", "POLL-abcd");
        when(worker.syncRepositoryAsync(web)).thenReturn(done("acme/web", true, false));
        when(worker.syncRepositoryAsync(api)).thenReturn(done("acme/api", true, false));
        when(worker.syncWatchedAsync(watched)).thenReturn(done("other/lib#5", true, false));

        PollCycleResultDto result = orchestrator.runPass();

        assertThat(result.getCorrelationId()).isEqualTo("POLL-abcd");
        assertThat(MDC.get("correlationId")).isEqualTo("POLL-abcd");
    }

    private static CompletableFuture<SyncResultDto> done(String target, boolean success, boolean degraded) {
        return CompletableFuture.completedFuture(SyncResultDto.builder()
                .target(target)
                .success(success)
                .degraded(degraded)
                .build());
    }
}
