package com.example.prsync.controller;

import com.example.prsync.dto.TransitionOutcome;
import com.example.prsync.dto.request.IssueActionRequest;
import com.example.prsync.dto.request.TransitionRequest;
import com.example.prsync.dto.response.BoardResponse;
import com.example.prsync.dto.response.IssueActionResponse;
import com.example.prsync.service.JiraIssueActionService;
import com.example.prsync.service.board.BoardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

/**
 * Board read-out and Jira actions for stored pull requests.
 *
 * Base path: /api/pull-requests
 * A failed transition or a rejected Jira update answers 409 with the outcome in the body.
 */
@RestController
@RequestMapping("/api/pull-requests")
@RequiredArgsConstructor
@Slf4j
public class PullRequestController {

    private final BoardService boardService;
    private final JiraIssueActionService jiraIssueActionService;

    @GetMapping("/board")
    public ResponseEntity<Map<String, Object>> getBoard() {
        BoardResponse board = boardService.board();
        return ResponseEntity.ok(wrap(board));
    }

    @PostMapping("/{owner}/{repo}/{number}/jira/transition")
    public ResponseEntity<Map<String, Object>> transition(@PathVariable String owner,
                                                          @PathVariable String repo,
                                                          @PathVariable int number,
                                                          @Valid @RequestBody TransitionRequest request) {
        log.info("Transition request for {}/{}#{}: lane={}, draft={}, issueKey={}",
                owner, repo, number, request.getLane(), request.getDraft(), request.getIssueKey());

        TransitionOutcome outcome = jiraIssueActionService.transition(owner, repo, number, request);
        return ResponseEntity.status(outcome.isSuccess() ? HttpStatus.OK : HttpStatus.CONFLICT).body(wrap(outcome));
    }

    @PostMapping("/{owner}/{repo}/{number}/jira/components")
    public ResponseEntity<Map<String, Object>> fixComponents(@PathVariable String owner,
                                                             @PathVariable String repo,
                                                             @PathVariable int number,
                                                             @RequestBody(required = false) IssueActionRequest request) {
        log.info("Component fix request for {}/{}#{}", owner, repo, number);

        IssueActionResponse response = jiraIssueActionService.fixComponents(owner, repo, number, issueKey(request));
        return ResponseEntity.status(response.isSuccess() ? HttpStatus.OK : HttpStatus.CONFLICT).body(wrap(response));
    }

    @PostMapping("/{owner}/{repo}/{number}/jira/assignee")
    public ResponseEntity<Map<String, Object>> assignToMe(@PathVariable String owner,
                                                          @PathVariable String repo,
                                                          @PathVariable int number,
                                                          @RequestBody(required = false) IssueActionRequest request) {
        log.info("Assignee fix request for {}/{}#{}", owner, repo, number);

        IssueActionResponse response = jiraIssueActionService.assignToMe(owner, repo, number, issueKey(request));
        return ResponseEntity.status(response.isSuccess() ? HttpStatus.OK : HttpStatus.CONFLICT).body(wrap(response));
    }

    private static String issueKey(IssueActionRequest request) {
        return request != null ? request.getIssueKey() : null;
    }

    private static Map<String, Object> wrap(Object data) {
        return Map.of(
                "data", data,
                "timestamp", Instant.now().toString());
    }
}
