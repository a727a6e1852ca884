package com.example.prsync.client.external;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.exception.RemoteUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GithubClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private GithubClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        PrSyncProperties properties = new PrSyncProperties(
                null, null, null, new PrSyncProperties.Http(Duration.ofSeconds(2)));
        client = new GithubClient(WebClient.builder().baseUrl(server.url("/graphql").toString()).build(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchRepoPullRequests_PostsQueryAndReturnsNodes() throws Exception {
        server.enqueue(json("""
                {"data":{"repository":{"pullRequests":{"nodes":[{"number":1},{"number":2}]}}}}
                """));

        List<JsonNode> nodes = client.fetchRepoPullRequests("acme", "web", 20);

        assertThat(nodes).extracting(node -> node.path("number").asInt()).containsExactly(1, 2);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("query").asText()).isEqualTo(GithubClient.REPO_PULL_REQUESTS_QUERY);
        assertThat(body.path("variables").path("owner").asText()).isEqualTo("acme");
        assertThat(body.path("variables").path("first").asInt()).isEqualTo(20);
    }

    @Test
    void fetchRepoPullRequests_MissingRepositoryIsEmpty() {
        server.enqueue(json("""
                {"data":{"repository":null},"errors":[{"type":"NOT_FOUND","message":"Could not resolve"}]}
                """));

        assertThat(client.fetchRepoPullRequests("acme", "gone", 20)).isEmpty();
    }

    @Test
    void fetchSinglePullRequest_ReturnsNodeOrEmpty() {
        server.enqueue(json("""
                {"data":{"repository":{"pullRequest":{"number":42,"state":"MERGED"}}}}
                """));
        server.enqueue(json("""
                {"data":{"repository":{"pullRequest":null}}}
                """));

        Optional<JsonNode> found = client.fetchSinglePullRequest("acme", "web", 42);
        Optional<JsonNode> missing = client.fetchSinglePullRequest("acme", "web", 43);

        assertThat(found).map(node -> node.path("state").asText()).contains("MERGED");
        assertThat(missing).isEmpty();
    }

    @Test
    void execute_ServerErrorBecomesRemoteUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThatThrownBy(() -> client.fetchRepoPullRequests("acme", "web", 20))
                .isInstanceOf(RemoteUnavailableException.class)
                .hasMessageContaining("502");
    }

    @Test
    void execute_ErrorsWithoutDataBecomeRemoteUnavailable() {
        server.enqueue(json("""
                {"errors":[{"message":"Bad credentials"}]}
                """));

        assertThatThrownBy(() -> client.fetchSinglePullRequest("acme", "web", 1))
                .isInstanceOf(RemoteUnavailableException.class)
                .hasMessageContaining("Bad credentials");
    }

    @Test
    void execute_SlowResponseTimesOut() {
        server.enqueue(json("{\"data\":{}}").setBodyDelay(5, TimeUnit.SECONDS));

        assertThatThrownBy(() -> client.fetchRepoPullRequests("acme", "web", 20))
                .isInstanceOf(RemoteUnavailableException.class);
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
