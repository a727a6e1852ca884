package com.example.prsync.service;

import com.example.prsync.client.external.JiraClient;
import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.IssueSnapshot;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.exception.RemoteUnavailableException;
import com.example.prsync.metrics.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Joins a pull request to its Jira issue and computes the component and assignee match flags.
 *
 * Never throws for remote faults: a failed lookup keeps the keys, leaves the rest null
 * and raises the {@link DegradedSyncSignal} for the current unit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IssueCorrelator {

    private final JiraClient jiraClient;
    private final PrSyncProperties properties;
    private final DegradedSyncSignal degradedSyncSignal;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public IssueCorrelationDto correlate(PullRequestDto pullRequest) {
        List<String> keys = pullRequest.getIssueKeys() != null ? pullRequest.getIssueKeys() : List.of();
        if (keys.isEmpty() || !jiraClient.isEnabled()) {
            return IssueCorrelationDto.keysOnly(keys);
        }

        String primaryKey = keys.get(0);
        IssueSnapshot snapshot;
        try {
            snapshot = jiraClient.fetchIssue(primaryKey);
        } catch (RemoteUnavailableException e) {
            log.warn("Jira lookup failed for {} (pull request {}#{}): {}",
                    primaryKey, pullRequest.repoFullName(), pullRequest.getNumber(), e.getMessage());
            syncMetrics.recordJiraLookupFailure();
            degradedSyncSignal.markDegraded("Jira lookup failed for " + primaryKey + ": " + e.getMessage());
            return IssueCorrelationDto.keysOnly(keys);
        }

        List<String> components = snapshot.getComponents() != null ? snapshot.getComponents() : List.of();
        IssueSnapshot.Assignee assignee = snapshot.getAssignee();

        return IssueCorrelationDto.builder()
                .jiraKey(primaryKey)
                .jiraKeys(new ArrayList<>(keys))
                .status(snapshot.getStatus())
                .summary(snapshot.getSummary())
                .url(snapshot.getUrl())
                .lastSyncedAt(LocalDateTime.now(clock))
                .components(new ArrayList<>(components))
                .componentsMatch(componentsMatch(components, pullRequest.getName(), properties.jira().componentRepoMap()))
                .assignee(assignee != null ? assignee.getDisplayName() : null)
                .assigneeMatch(assigneeMatch(assignee, identityAllowSet()))
                .build();
    }

    /**
     * @return true if any component belongs to the repo, false if none does, null if there are no components
     */
    public static Boolean componentsMatch(List<String> components, String repoName, Map<String, String> componentRepoMap) {
        if (components == null || components.isEmpty()) {
            return null;
        }
        Map<String, String> normalizedMap = normalizeMap(componentRepoMap);
        return components.stream().anyMatch(component -> componentMatchesRepo(component, repoName, normalizedMap));
    }

    /**
     * A component matches when the mapping sends it to the repo, or when the repo name is contained in it.
     * Both sides are compared lower-case with non-alphanumerics removed.
     */
    public static boolean componentMatchesRepo(String component, String repoName, Map<String, String> componentRepoMap) {
        String normalizedComponent = normalize(component);
        String normalizedRepo = normalize(repoName);
        if (normalizedComponent.isEmpty() || normalizedRepo.isEmpty()) {
            return false;
        }
        String mapped = normalizeMap(componentRepoMap).get(normalizedComponent);
        if (mapped != null && mapped.equals(normalizedRepo)) {
            return true;
        }
        return normalizedComponent.contains(normalizedRepo);
    }

    /**
     * @return false without an assignee, null without configured identities
     */
    static Boolean assigneeMatch(IssueSnapshot.Assignee assignee, Set<String> allowSet) {
        if (assignee == null) {
            return false;
        }
        if (allowSet.isEmpty()) {
            return null;
        }
        for (String candidate : new String[]{assignee.getDisplayName(), assignee.getEmailAddress()}) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String lowered = candidate.toLowerCase(Locale.ROOT);
            if (allowSet.contains(lowered) || allowSet.contains(lowered.replace(" ", ""))) {
                return true;
            }
        }
        return false;
    }

    Set<String> identityAllowSet() {
        Set<String> allowSet = new HashSet<>();
        for (String identity : new String[]{
                properties.jira().username(), properties.jira().email(), properties.github().username()}) {
            if (identity != null && !identity.isBlank()) {
                String lowered = identity.trim().toLowerCase(Locale.ROOT);
                allowSet.add(lowered);
                allowSet.add(lowered.replace(" ", ""));
            }
        }
        return allowSet;
    }

    static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private static Map<String, String> normalizeMap(Map<String, String> componentRepoMap) {
        Map<String, String> normalized = new HashMap<>();
        if (componentRepoMap != null) {
            componentRepoMap.forEach((component, repo) -> normalized.put(normalize(component), normalize(repo)));
        }
        return normalized;
    }
}
