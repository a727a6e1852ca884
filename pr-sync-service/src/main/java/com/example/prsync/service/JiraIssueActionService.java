package com.example.prsync.service;

import com.example.prsync.client.external.JiraClient;
import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.JiraComponent;
import com.example.prsync.dto.TransitionOutcome;
import com.example.prsync.dto.request.TransitionRequest;
import com.example.prsync.dto.response.IssueActionResponse;
import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.exception.AuthorizationDeniedException;
import com.example.prsync.exception.ConfigurationGapException;
import com.example.prsync.exception.PullRequestNotFoundException;
import com.example.prsync.repository.PullRequestRecordRepository;
import com.example.prsync.service.transition.WorkflowTransitionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Operator-triggered mutations on the Jira issue linked to one of my pull requests.
 *
 * Authorization runs before any remote call: the record must exist, be mine,
 * and the issue key must be one of its linked keys.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JiraIssueActionService {

    private final PullRequestRecordRepository pullRequestRecordRepository;
    private final JiraClient jiraClient;
    private final WorkflowTransitionResolver workflowTransitionResolver;
    private final PrSyncProperties properties;

    public TransitionOutcome transition(String owner, String repo, int number, TransitionRequest request) {
        Authorized authorized = authorize(owner, repo, number, request.getIssueKey());
        boolean draft = request.getDraft() != null ? request.getDraft() : authorized.record().isDraft();
        return workflowTransitionResolver.moveToLane(authorized.issueKey(), request.getLane(), draft);
    }

    /**
     * Add the project components that belong to this repository and are not on the issue yet.
     */
    public IssueActionResponse fixComponents(String owner, String repo, int number, String issueKey) {
        Authorized authorized = authorize(owner, repo, number, issueKey);
        requireJira();

        String key = authorized.issueKey();
        String projectKey = key.substring(0, key.indexOf('-'));
        List<String> present = authorized.record().getJiraComponents() != null
                ? authorized.record().getJiraComponents() : List.of();

        List<JiraComponent> toAdd = jiraClient.fetchProjectComponents(projectKey).stream()
                .filter(component -> IssueCorrelator.componentMatchesRepo(
                        component.name(), repo, properties.jira().componentRepoMap()))
                .filter(component -> present.stream().noneMatch(name -> name.equalsIgnoreCase(component.name())))
                .toList();

        if (toAdd.isEmpty()) {
            log.info("No components to add to {} for repository {}", key, repo);
            return IssueActionResponse.builder()
                    .issueKey(key)
                    .success(true)
                    .changed(false)
                    .message("No missing project component matches repository " + repo)
                    .components(present)
                    .build();
        }

        List<String> names = toAdd.stream().map(JiraComponent::name).toList();
        boolean accepted = jiraClient.addComponents(key, toAdd.stream().map(JiraComponent::id).toList());
        log.info("Component update for {} ({}): accepted={}", key, names, accepted);
        return IssueActionResponse.builder()
                .issueKey(key)
                .success(accepted)
                .changed(accepted)
                .message(accepted ? "Added components " + names : "Jira rejected the component update")
                .components(names)
                .build();
    }

    public IssueActionResponse assignToMe(String owner, String repo, int number, String issueKey) {
        Authorized authorized = authorize(owner, repo, number, issueKey);
        requireJira();

        String key = authorized.issueKey();
        boolean accepted = jiraClient.assignIssue(key);
        log.info("Assignee update for {}: accepted={}", key, accepted);
        return IssueActionResponse.builder()
                .issueKey(key)
                .success(accepted)
                .changed(accepted)
                .message(accepted ? "Assigned to " + properties.jira().email() : "Jira rejected the assignee update")
                .assignee(accepted ? properties.jira().email() : null)
                .build();
    }

    Authorized authorize(String owner, String repo, int number, String requestedKey) {
        PullRequestRecord record = pullRequestRecordRepository.findByRepoOwnerAndRepoNameAndNumber(owner, repo, number)
                .orElseThrow(() -> new PullRequestNotFoundException(owner, repo, number));

        if (!record.isMine()) {
            log.warn("Rejected Jira mutation on {}/{}#{}: not authored by tracked account", owner, repo, number);
            throw new AuthorizationDeniedException("Pull request " + owner + "/" + repo + "#" + number
                    + " is not owned by the tracked account");
        }

        String issueKey = requestedKey != null && !requestedKey.isBlank()
                ? requestedKey.trim().toUpperCase(Locale.ROOT)
                : record.getJiraKey();
        if (issueKey == null || !record.isLinkedTo(issueKey)) {
            log.warn("Rejected Jira mutation on {}/{}#{}: issue {} not linked", owner, repo, number, issueKey);
            throw new AuthorizationDeniedException("Issue " + issueKey + " is not linked to pull request "
                    + owner + "/" + repo + "#" + number);
        }
        return new Authorized(record, issueKey);
    }

    private void requireJira() {
        if (!jiraClient.isEnabled()) {
            throw new ConfigurationGapException("Jira integration is not configured");
        }
    }

    record Authorized(PullRequestRecord record, String issueKey) {
    }
}
