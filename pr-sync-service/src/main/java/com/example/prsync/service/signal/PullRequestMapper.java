package com.example.prsync.service.signal;

import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.entity.PullRequestState;
import com.example.prsync.metrics.SyncMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.prsync.service.signal.SignalDerivation.text;

/**
 * Adapter from raw GitHub GraphQL nodes to {@link PullRequestDto}.
 * Applies signal derivation and issue key extraction. Never throws on malformed input.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PullRequestMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final IssueKeyExtractor issueKeyExtractor;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public PullRequestDto toDto(String owner, String name, JsonNode node) {
        int number = node.path("number").asInt();
        String recordId = owner + "/" + name + "#" + number;

        String title = text(node.path("title"));
        String headRefName = text(node.path("headRefName"));
        String body = text(node.path("body"));

        List<String> requestedReviewers = new ArrayList<>();
        List<String> requestedTeams = new ArrayList<>();
        for (JsonNode request : node.path("reviewRequests").path("nodes")) {
            JsonNode reviewer = request.path("requestedReviewer");
            if (reviewer.hasNonNull("login")) {
                requestedReviewers.add(reviewer.get("login").asText());
            }
            if (reviewer.hasNonNull("slug")) {
                requestedTeams.add(reviewer.get("slug").asText());
            }
        }

        String author = text(node.path("author").path("login"));
        String mergedAt = text(node.path("mergedAt"));

        return PullRequestDto.builder()
                .owner(owner)
                .name(name)
                .number(number)
                .title(title != null ? title : "")
                .author(author != null ? author : "unknown")
                .url(text(node.path("url")))
                .headRefName(headRefName)
                .body(body)
                .state(PullRequestState.fromRemote(text(node.path("state"))))
                .draft(node.path("isDraft").asBoolean(false))
                .reviewStatus(SignalDerivation.reviewStatus(node))
                .ciSummary(SignalDerivation.ciSummary(node))
                .mergeCiSummary(SignalDerivation.mergeCiSummary(node))
                .lastCommitSha(text(node.path("commitsWithStatus").path("nodes").path(0).path("commit").path("oid")))
                .mergeCommitSha(text(node.path("mergeCommit").path("oid")))
                .hasConflicts(SignalDerivation.hasConflicts(node))
                .sizeTier(SignalDerivation.sizeTier(node))
                .updatedAt(parseTimestamp(text(node.path("updatedAt")), "updatedAt", recordId))
                .mergedAt(mergedAt != null ? parseTimestamp(mergedAt, "mergedAt", recordId) : null)
                .raw(rawSnapshot(node, recordId))
                .requestedReviewers(requestedReviewers)
                .requestedReviewTeams(requestedTeams)
                .issueKeys(issueKeyExtractor.extract(title, headRefName, body))
                .build();
    }

    private Map<String, Object> rawSnapshot(JsonNode node, String recordId) {
        Map<String, Object> raw;
        try {
            raw = new LinkedHashMap<>(objectMapper.convertValue(node, MAP_TYPE));
        } catch (IllegalArgumentException e) {
            log.warn("Could not convert raw node to map. recordId={} error={}", recordId, e.getMessage());
            raw = new LinkedHashMap<>();
        }
        raw.put("size_sparkline", SignalDerivation.sizeSparkline(node));
        return raw;
    }

    /**
     * Parse an ISO 8601 timestamp to UTC LocalDateTime.
     * Increments parser_warning_count and falls back to now when parsing fails.
     */
    private LocalDateTime parseTimestamp(String value, String fieldName, String recordId) {
        if (value != null && !value.isBlank()) {
            try {
                return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            } catch (Exception e) {
                log.warn("Failed to parse {}. recordId={} rawValue=[{}]. Fallback to now(). Error: {}",
                        fieldName, recordId, value, e.getMessage());
            }
        } else {
            log.warn("Missing {}. recordId={}. Fallback to now().", fieldName, recordId);
        }
        syncMetrics.recordParserWarning();
        return LocalDateTime.now(clock);
    }
}
