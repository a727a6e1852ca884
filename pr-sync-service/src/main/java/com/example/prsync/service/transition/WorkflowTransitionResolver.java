package com.example.prsync.service.transition;

import com.example.prsync.client.external.JiraClient;
import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.IssueSnapshot;
import com.example.prsync.dto.TransitionOutcome;
import com.example.prsync.dto.TransitionPathStep;
import com.example.prsync.dto.TransitionStep;
import com.example.prsync.exception.ConfigurationGapException;
import com.example.prsync.exception.RemoteUnavailableException;
import com.example.prsync.metrics.SyncMetrics;
import com.example.prsync.service.board.BoardLane;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Moves a Jira issue into one of the statuses accepted by a board lane.
 *
 * Tries a direct transition first. Otherwise walks the path table for at most
 * {@value #MAX_ITERATIONS} iterations, re-reading the issue before every hop.
 * Applied steps are never rolled back; failures are returned, not thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowTransitionResolver {

    static final int MAX_ITERATIONS = 6;

    private final JiraClient jiraClient;
    private final PrSyncProperties properties;
    private final TransitionPathTable transitionPathTable;
    private final SyncMetrics syncMetrics;

    /**
     * @throws ConfigurationGapException when Jira is disabled or the lane has no target statuses
     */
    public TransitionOutcome moveToLane(String issueKey, BoardLane lane, boolean draft) {
        if (!jiraClient.isEnabled()) {
            throw new ConfigurationGapException("Jira integration is not configured");
        }
        String group = lane.statusGroup(draft);
        List<String> targets = group != null ? properties.jira().statusesFor(group) : List.of();
        if (targets.isEmpty()) {
            throw new ConfigurationGapException("No target statuses configured for lane '" + lane.title() + "'"
                    + (draft ? " (draft)" : ""));
        }

        Run run = new Run(issueKey, targets, transitionPathTable.candidatesFor(group));
        log.info("Moving {} to lane '{}' (draft={}), targets={}", issueKey, lane.title(), draft, targets);
        try {
            return resolve(run);
        } catch (RemoteUnavailableException e) {
            log.warn("Jira unavailable while moving {} after {} step(s): {}",
                    issueKey, run.steps.size(), e.getMessage());
            return run.fail("remote unavailable: " + e.getMessage());
        }
    }

    private TransitionOutcome resolve(Run run) {
        IssueSnapshot issue = jiraClient.fetchIssue(run.issueKey);
        run.lastStatus = issue.getStatus();
        if (!issue.isFound()) {
            return run.fail("issue not found");
        }
        if (run.isTarget(run.lastStatus)) {
            return run.succeed();
        }

        Optional<TransitionStep> direct = pickDirect(jiraClient.fetchTransitions(run.issueKey), run.targets);
        if (direct.isPresent()) {
            return applyDirect(run, direct.get());
        }

        for (int iteration = 1; iteration <= MAX_ITERATIONS; iteration++) {
            run.lastStatus = jiraClient.fetchIssue(run.issueKey).getStatus();
            if (run.isTarget(run.lastStatus)) {
                return run.succeed();
            }

            List<TransitionStep> transitions = jiraClient.fetchTransitions(run.issueKey);
            direct = pickDirect(transitions, run.targets);
            if (direct.isPresent()) {
                return applyDirect(run, direct.get());
            }

            Optional<TransitionPathStep> candidate = run.candidates.stream()
                    .filter(step -> step.fromStatus() != null && step.fromStatus().equalsIgnoreCase(run.lastStatus))
                    .findFirst();
            if (candidate.isEmpty()) {
                return run.fail("no matching transition for target status from status '" + run.lastStatus + "'");
            }

            Optional<TransitionStep> resolved = resolveStep(candidate.get(), transitions);
            if (resolved.isEmpty()) {
                return run.fail("transition '" + candidate.get().hint() + "' not available from status '"
                        + run.lastStatus + "'");
            }

            TransitionStep step = resolved.get();
            log.debug("Iteration {} for {}: applying '{}' from '{}'", iteration, run.issueKey, step.name(), run.lastStatus);
            if (!apply(run, step)) {
                return run.fail("transition '" + step.name() + "' rejected from status '" + run.lastStatus + "'");
            }
        }

        run.lastStatus = jiraClient.fetchIssue(run.issueKey).getStatus();
        if (run.isTarget(run.lastStatus)) {
            return run.succeed();
        }
        return run.fail("cannot reach target status after " + MAX_ITERATIONS + " iterations; last status '"
                + run.lastStatus + "'");
    }

    private TransitionOutcome applyDirect(Run run, TransitionStep step) {
        if (!apply(run, step)) {
            return run.fail("transition '" + step.name() + "' rejected from status '" + run.lastStatus + "'");
        }
        return run.succeed();
    }

    private boolean apply(Run run, TransitionStep step) {
        if (!jiraClient.applyTransition(run.issueKey, step.id())) {
            return false;
        }
        syncMetrics.recordTransitionApplied();
        run.steps.add(step);
        if (step.toStatus() != null) {
            run.lastStatus = step.toStatus();
        }
        log.info("Applied transition '{}' to {} (now '{}')", step.name(), run.issueKey, run.lastStatus);
        return true;
    }

    /**
     * First transition whose destination status is a target, else the first whose own name is a target.
     */
    static Optional<TransitionStep> pickDirect(List<TransitionStep> transitions, List<String> targets) {
        List<String> lowered = targets.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        Optional<TransitionStep> byDestination = transitions.stream()
                .filter(t -> t.toStatus() != null && lowered.contains(t.toStatus().toLowerCase(Locale.ROOT)))
                .findFirst();
        if (byDestination.isPresent()) {
            return byDestination;
        }
        return transitions.stream()
                .filter(t -> t.name() != null && lowered.contains(t.name().toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /**
     * Explicit id wins. Otherwise exact name match (transition name, then destination),
     * then substring match in the same order.
     */
    static Optional<TransitionStep> resolveStep(TransitionPathStep candidate, List<TransitionStep> transitions) {
        if (candidate.transitionId() != null && !candidate.transitionId().isBlank()) {
            TransitionStep permitted = transitions.stream()
                    .filter(t -> candidate.transitionId().equals(t.id()))
                    .findFirst()
                    .orElse(null);
            return Optional.of(permitted != null
                    ? permitted
                    : new TransitionStep(candidate.transitionId(), candidate.hint(), null));
        }

        String hint = candidate.hint();
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String needle = hint.toLowerCase(Locale.ROOT);

        for (TransitionStep t : transitions) {
            if (equalsLower(t.name(), needle) || equalsLower(t.toStatus(), needle)) {
                return Optional.of(t);
            }
        }
        for (TransitionStep t : transitions) {
            if (containsLower(t.name(), needle) || containsLower(t.toStatus(), needle)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    private static boolean equalsLower(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).equals(needle);
    }

    private static boolean containsLower(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static final class Run {
        private final String issueKey;
        private final List<String> targets;
        private final List<TransitionPathStep> candidates;
        private final List<TransitionStep> steps = new ArrayList<>();
        private String lastStatus;

        private Run(String issueKey, List<String> targets, List<TransitionPathStep> candidates) {
            this.issueKey = issueKey;
            this.targets = targets;
            this.candidates = candidates;
        }

        private boolean isTarget(String status) {
            return status != null && targets.stream().anyMatch(status::equalsIgnoreCase);
        }

        private TransitionOutcome succeed() {
            log.info("Issue {} reached '{}' in {} step(s)", issueKey, lastStatus, steps.size());
            return outcome(true, null);
        }

        private TransitionOutcome fail(String reason) {
            log.warn("Could not move {}: {} (steps applied: {})", issueKey, reason, steps.size());
            return outcome(false, reason);
        }

        private TransitionOutcome outcome(boolean success, String reason) {
            return TransitionOutcome.builder()
                    .success(success)
                    .issueKey(issueKey)
                    .targetStatuses(new ArrayList<>(targets))
                    .appliedSteps(new ArrayList<>(steps))
                    .finalStatus(lastStatus)
                    .failureReason(reason)
                    .candidates(new ArrayList<>(candidates))
                    .build();
        }
    }
}
