package com.example.prsync.service.signal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Signal derivation over hand-written GraphQL nodes.
 */
class SignalDerivationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void reviewStatus_ApprovedWinsOverChangesRequested() throws Exception {
        JsonNode node = json("""
                {"reviews":{"nodes":[
                  {"state":"CHANGES_REQUESTED"},
                  {"state":"APPROVED"},
                  {"state":"COMMENTED"}
                ]}}
                """);

        assertThat(SignalDerivation.reviewStatus(node)).isEqualTo("approved");
    }

    @Test
    void reviewStatus_ChangesRequestedWinsOverCommented() throws Exception {
        JsonNode node = json("""
                {"reviews":{"nodes":[{"state":"COMMENTED"},{"state":"CHANGES_REQUESTED"}]}}
                """);

        assertThat(SignalDerivation.reviewStatus(node)).isEqualTo("changes requested");
    }

    @Test
    void reviewStatus_FallsBackToMostRecentState() throws Exception {
        JsonNode node = json("""
                {"reviews":{"nodes":[{"state":"PENDING"},{"state":"COMMENTED"}]}}
                """);

        assertThat(SignalDerivation.reviewStatus(node)).isEqualTo("commented");
    }

    @Test
    void reviewStatus_EmptyReviewsNeedReview() throws Exception {
        assertThat(SignalDerivation.reviewStatus(json("{\"reviews\":{\"nodes\":[]}}"))).isEqualTo("needs review");
        assertThat(SignalDerivation.reviewStatus(json("{}"))).isEqualTo("needs review");
    }

    @Test
    void reviewStatus_OnlyDismissedNeedsReReview() throws Exception {
        JsonNode node = json("""
                {"reviews":{"nodes":[{"state":"DISMISSED"},{"state":"DISMISSED"}]}}
                """);

        assertThat(SignalDerivation.reviewStatus(node)).isEqualTo("needs re-review");
    }

    @Test
    void reviewStatus_OnlyLastTenReviewsCount() throws Exception {
        List<String> states = new ArrayList<>(List.of("APPROVED", "APPROVED"));
        states.addAll(Collections.nCopies(10, "COMMENTED"));

        assertThat(SignalDerivation.reviewStatus(reviews(states))).isEqualTo("commented");
    }

    @Test
    void reviewStatus_DismissedInsideWindowStillCounts() throws Exception {
        List<String> states = new ArrayList<>(List.of("CHANGES_REQUESTED"));
        states.addAll(Collections.nCopies(10, "DISMISSED"));

        assertThat(SignalDerivation.reviewStatus(reviews(states))).isEqualTo("needs re-review");
    }

    @Test
    void reviewStatus_UnknownStateIsLowerCased() throws Exception {
        assertThat(SignalDerivation.reviewStatus(reviews(List.of("PENDING", "SOME_NEW_STATE"))))
                .isEqualTo("some_new_state");
        assertThat(SignalDerivation.reviewStatus(reviews(List.of("COMMENTED", "PENDING"))))
                .isEqualTo(ReviewStatus.PENDING.label());
    }

    @Test
    void ciSummary_ReportsRollupStateAndCheckCount() throws Exception {
        JsonNode node = json("""
                {"commitsWithStatus":{"nodes":[{"commit":{"statusCheckRollup":{
                  "state":"SUCCESS","contexts":{"nodes":[{},{},{}]}}}}]}}
                """);

        assertThat(SignalDerivation.ciSummary(node)).isEqualTo("SUCCESS (3 checks)");
    }

    @Test
    void ciSummary_NoCommitsAndNoRollup() throws Exception {
        assertThat(SignalDerivation.ciSummary(json("{}"))).isEqualTo("no commits");
        assertThat(SignalDerivation.ciSummary(json("""
                {"commitsWithStatus":{"nodes":[{"commit":{"statusCheckRollup":null}}]}}
                """))).isEqualTo("no checks");
    }

    @Test
    void mergeCiSummary_NullWithoutMergeCommit() throws Exception {
        assertThat(SignalDerivation.mergeCiSummary(json("{\"mergeCommit\":null}"))).isNull();
        assertThat(SignalDerivation.mergeCiSummary(json("""
                {"mergeCommit":{"oid":"abc","statusCheckRollup":{"state":"FAILURE","contexts":{"nodes":[{}]}}}}
                """))).isEqualTo("FAILURE (1 merge checks)");
    }

    @Test
    void hasConflicts_OnlyForDirtyMergeState() throws Exception {
        assertThat(SignalDerivation.hasConflicts(json("{\"mergeStateStatus\":\"DIRTY\"}"))).isTrue();
        assertThat(SignalDerivation.hasConflicts(json("{\"mergeStateStatus\":\"BLOCKED\"}"))).isFalse();
        assertThat(SignalDerivation.hasConflicts(json("{\"mergeStateStatus\":\"UNKNOWN\"}"))).isFalse();
        assertThat(SignalDerivation.hasConflicts(json("{}"))).isFalse();
    }

    @Test
    void sizeTier_BoundariesAreHalfOpen() {
        // 9 files + 3 commits = 1.95
        assertThat(SignalDerivation.sizeTier(0, 9, 3)).isZero();
        // 10 files = 2.0, exactly on the first threshold
        assertThat(SignalDerivation.sizeTier(0, 10, 0)).isEqualTo(1);
        assertThat(SignalDerivation.sizeTier(0, 20, 0)).isEqualTo(2);
        assertThat(SignalDerivation.sizeTier(0, 35, 0)).isEqualTo(3);
        assertThat(SignalDerivation.sizeTier(0, 55, 0)).isEqualTo(4);
        assertThat(SignalDerivation.sizeTier(0, 90, 0)).isEqualTo(5);
        assertThat(SignalDerivation.sizeTier(100_000, 500, 300)).isEqualTo(5);
    }

    @Test
    void sizeTier_IsMonotonicInChurn() {
        int previous = 0;
        for (int churn = 0; churn <= 3000; churn += 50) {
            int tier = SignalDerivation.sizeTier(churn, 0, 0);
            assertThat(tier).isGreaterThanOrEqualTo(previous);
            previous = tier;
        }
        assertThat(previous).isEqualTo(5);
    }

    @Test
    void sizeTier_ReadsCountsFromNode() throws Exception {
        JsonNode node = json("""
                {"additions":150,"deletions":50,"changedFiles":3,"commitTotals":{"totalCount":4}}
                """);

        // 2.0 + 0.6 + 0.2 = 2.8
        assertThat(SignalDerivation.sizeTier(node)).isEqualTo(1);
    }

    @Test
    void sizeSparkline_RisesToNormalisedSize() throws Exception {
        JsonNode node = json("{\"additions\":400,\"deletions\":100,\"changedFiles\":25}");

        List<Double> sparkline = SignalDerivation.sizeSparkline(node);

        // min(500 + 500, 2000) / 2000 = 0.5
        assertThat(sparkline).hasSize(10);
        assertThat(sparkline.get(0)).isCloseTo(0.05, within(1e-9));
        assertThat(sparkline.get(9)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void sizeSparkline_CapsLargeChanges() throws Exception {
        List<Double> sparkline = SignalDerivation.sizeSparkline(json("{\"additions\":90000,\"changedFiles\":400}"));

        assertThat(sparkline.get(9)).isCloseTo(1.0, within(1e-9));
    }

    private JsonNode reviews(List<String> states) throws Exception {
        String nodes = states.stream()
                .map(state -> "{\"state\":\"" + state + "\"}")
                .collect(Collectors.joining(","));
        return json("{\"reviews\":{\"nodes\":[" + nodes + "]}}");
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
