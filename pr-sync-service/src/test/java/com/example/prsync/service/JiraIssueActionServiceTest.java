package com.example.prsync.service;

import com.example.prsync.client.external.JiraClient;
import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.JiraComponent;
import com.example.prsync.dto.TransitionOutcome;
import com.example.prsync.dto.request.TransitionRequest;
import com.example.prsync.dto.response.IssueActionResponse;
import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.entity.PullRequestState;
import com.example.prsync.exception.AuthorizationDeniedException;
import com.example.prsync.exception.ConfigurationGapException;
import com.example.prsync.exception.PullRequestNotFoundException;
import com.example.prsync.repository.PullRequestRecordRepository;
import com.example.prsync.service.board.BoardLane;
import com.example.prsync.service.transition.WorkflowTransitionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Authorization runs before any Jira call.
 */
class JiraIssueActionServiceTest {

    private PullRequestRecordRepository repository;
    private JiraClient jiraClient;
    private WorkflowTransitionResolver resolver;
    private JiraIssueActionService service;

    @BeforeEach
    void setUp() {
        repository = mock(PullRequestRecordRepository.class);
        jiraClient = mock(JiraClient.class);
        resolver = mock(WorkflowTransitionResolver.class);
        PrSyncProperties properties = new PrSyncProperties(
                new PrSyncProperties.Github(null, null, "alice", 20),
                new PrSyncProperties.Jira("https://jira.example.com", "alice@example.com", "token", null,
                        List.of(), Map.of("Storefront", "web"), Map.of(), null),
                null, null);
        service = new JiraIssueActionService(repository, jiraClient, resolver, properties);
        when(jiraClient.isEnabled()).thenReturn(true);
    }

    @Test
    void transition_UnknownPullRequestIsNotFound() {
        when(repository.findByRepoOwnerAndRepoNameAndNumber("acme", "web", 1)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.transition("acme", "web", 1, new TransitionRequest(BoardLane.MERGED, null, null)))
                .isInstanceOf(PullRequestNotFoundException.class);
        verifyNoInteractions(jiraClient, resolver);
    }

    @Test
    void transition_SomeoneElsesPullRequestIsDenied() {
        stored(record(false, "PROJ-1", List.of("PROJ-1")));

        assertThatThrownBy(() -> service.transition("acme", "web", 1, new TransitionRequest(BoardLane.MERGED, null, null)))
                .isInstanceOf(AuthorizationDeniedException.class);
        verifyNoInteractions(jiraClient, resolver);
    }

    @Test
    void transition_UnlinkedIssueKeyIsDenied() {
        stored(record(true, "PROJ-1", List.of("PROJ-1", "PROJ-2")));

        assertThatThrownBy(() -> service.transition("acme", "web", 1, new TransitionRequest(BoardLane.MERGED, null, "OPS-9")))
                .isInstanceOf(AuthorizationDeniedException.class)
                .hasMessageContaining("OPS-9");
        verifyNoInteractions(jiraClient, resolver);
    }

    @Test
    void transition_NoLinkedIssueIsDenied() {
        stored(record(true, null, List.of()));

        assertThatThrownBy(() -> service.fixComponents("acme", "web", 1, null))
                .isInstanceOf(AuthorizationDeniedException.class);
        verifyNoInteractions(jiraClient);
    }

    @Test
    void transition_DefaultsToPrimaryKeyAndRecordDraftFlag() {
        PullRequestRecord record = record(true, "PROJ-1", List.of("PROJ-1", "PROJ-2"));
        record.setDraft(true);
        stored(record);
        TransitionOutcome outcome = TransitionOutcome.builder().success(true).issueKey("PROJ-1").build();
        when(resolver.moveToLane("PROJ-1", BoardLane.NEEDS_REVIEW, true)).thenReturn(outcome);

        TransitionOutcome result = service.transition("acme", "web", 1, new TransitionRequest(BoardLane.NEEDS_REVIEW, null, " "));

        assertThat(result).isSameAs(outcome);
    }

    @Test
    void transition_ExplicitSecondaryKeyAndDraftOverride() {
        stored(record(true, "PROJ-1", List.of("PROJ-1", "PROJ-2")));
        when(resolver.moveToLane(anyString(), any(), anyBoolean()))
                .thenReturn(TransitionOutcome.builder().success(true).build());

        service.transition("acme", "web", 1, new TransitionRequest(BoardLane.NEEDS_REVIEW, false, "proj-2"));

        verify(resolver).moveToLane("PROJ-2", BoardLane.NEEDS_REVIEW, false);
    }

    @Test
    void fixComponents_AddsOnlyMissingMatchingComponents() {
        PullRequestRecord record = record(true, "PROJ-1", List.of("PROJ-1"));
        record.setJiraComponents(new ArrayList<>(List.of("Web Frontend")));
        stored(record);
        when(jiraClient.fetchProjectComponents("PROJ")).thenReturn(List.of(
                new JiraComponent("100", "Web Frontend"),
                new JiraComponent("101", "Storefront"),
                new JiraComponent("102", "Mobile")));
        when(jiraClient.addComponents("PROJ-1", List.of("101"))).thenReturn(true);

        IssueActionResponse response = service.fixComponents("acme", "web", 1, null);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isChanged()).isTrue();
        assertThat(response.getComponents()).containsExactly("Storefront");
    }

    @Test
    void fixComponents_NothingToAddSkipsUpdate() {
        stored(record(true, "PROJ-1", List.of("PROJ-1")));
        when(jiraClient.fetchProjectComponents("PROJ")).thenReturn(List.of(new JiraComponent("102", "Mobile")));

        IssueActionResponse response = service.fixComponents("acme", "web", 1, "PROJ-1");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isChanged()).isFalse();
        verify(jiraClient, never()).addComponents(anyString(), any());
    }

    @Test
    void fixComponents_JiraDisabledIsConfigurationGap() {
        stored(record(true, "PROJ-1", List.of("PROJ-1")));
        when(jiraClient.isEnabled()).thenReturn(false);

        assertThatThrownBy(() -> service.fixComponents("acme", "web", 1, null))
                .isInstanceOf(ConfigurationGapException.class);
        verify(jiraClient, never()).fetchProjectComponents(anyString());
    }

    @Test
    void assignToMe_ReportsAcceptedAndRejected() {
        stored(record(true, "PROJ-1", List.of("PROJ-1")));
        when(jiraClient.assignIssue("PROJ-1")).thenReturn(true, false);

        IssueActionResponse accepted = service.assignToMe("acme", "web", 1, null);
        IssueActionResponse rejected = service.assignToMe("acme", "web", 1, null);

        assertThat(accepted.isSuccess()).isTrue();
        assertThat(accepted.getAssignee()).isEqualTo("alice@example.com");
        assertThat(rejected.isSuccess()).isFalse();
        assertThat(rejected.getAssignee()).isNull();
    }

    @Test
    void assignToMe_SomeoneElsesPullRequestIsDenied() {
        stored(record(false, "PROJ-1", List.of("PROJ-1")));

        assertThatThrownBy(() -> service.assignToMe("acme", "web", 1, null))
                .isInstanceOf(AuthorizationDeniedException.class);
        verifyNoInteractions(jiraClient);
    }

    private void stored(PullRequestRecord record) {
        when(repository.findByRepoOwnerAndRepoNameAndNumber("acme", "web", 1)).thenReturn(Optional.of(record));
    }

    private static PullRequestRecord record(boolean mine, String jiraKey, List<String> jiraKeys) {
        return PullRequestRecord.builder()
                .id(1L)
                .repoOwner("acme")
                .repoName("web")
                .number(1)
                .title("t")
                .author(mine ? "alice" : "bob")
                .state(PullRequestState.OPEN)
                .mine(mine)
                .jiraKey(jiraKey)
                .jiraKeys(new ArrayList<>(jiraKeys))
                .build();
    }
}
