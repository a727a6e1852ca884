package com.example.prsync.scheduler;

import com.example.prsync.service.PollCycleOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Drives the periodic poll pass.
 *
 * CRITICAL DESIGN:
 * - @SchedulerLock ensures only ONE replica polls at a time
 * - Fixed delay: the next pass starts one interval after the previous one finished
 * - A failing pass is logged and the schedule continues
 * - Can be disabled via prsync.scheduler.enabled=false
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "prsync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class PollScheduler {

    private final PollCycleOrchestrator pollCycleOrchestrator;

    @Scheduled(fixedDelayString = "${prsync.poll.interval:PT15S}",
            initialDelayString = "${prsync.poll.interval:PT15S}")
    @SchedulerLock(
            name = "pollPullRequests",
            lockAtMostFor = "${prsync.scheduler.lock-at-most-for:PT10M}",
            lockAtLeastFor = "${prsync.scheduler.lock-at-least-for:PT5S}"
    )
    public void pollPullRequests() {
        String correlationId = "POLL-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            log.info("=== Starting scheduled poll pass: correlationId={} ===", correlationId);
            pollCycleOrchestrator.runPass();
            log.info("=== Completed scheduled poll pass: correlationId={} ===", correlationId);
        } catch (Exception e) {
            log.error("Error in scheduled poll pass: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
