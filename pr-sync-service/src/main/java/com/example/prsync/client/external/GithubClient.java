package com.example.prsync.client.external;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.exception.RemoteUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the GitHub GraphQL API.
 *
 * - Must be called OUTSIDE @Transactional
 * - No retries: a failed call surfaces as {@link RemoteUnavailableException} and the
 *   unit is picked up again on the next poll pass
 * - Circuit breaker stops hammering GitHub while it is down
 */
@Component
@Slf4j
public class GithubClient {

    private static final String REMOTE = "github";

    private static final String PULL_REQUEST_FIELDS = """
            number
            title
            body
            url
            headRefName
            author { login }
            isDraft
            state
            additions
            deletions
            changedFiles
            commitTotals: commits { totalCount }
            mergeStateStatus
            updatedAt
            mergedAt
            reviewRequests(first: 10) {
              nodes {
                requestedReviewer {
                  ... on User { login }
                  ... on Team { slug }
                }
              }
            }
            reviews(last: 10) {
              nodes {
                author { login }
                state
              }
            }
            commitsWithStatus: commits(last: 1) {
              nodes {
                commit {
                  oid
                  statusCheckRollup { ...rollupFields }
                }
              }
            }
            mergeCommit {
              oid
              statusCheckRollup { ...rollupFields }
            }
            """;

    private static final String ROLLUP_FRAGMENT = """
            fragment rollupFields on StatusCheckRollup {
              state
              contexts(first: 10) {
                nodes {
                  __typename
                  ... on CheckRun { name status conclusion }
                  ... on StatusContext { context state }
                }
              }
            }
            """;

    static final String REPO_PULL_REQUESTS_QUERY = """
            query RepoPullRequests($owner: String!, $name: String!, $first: Int!) {
              repository(owner: $owner, name: $name) {
                pullRequests(first: $first, states: [OPEN, MERGED], orderBy: {field: UPDATED_AT, direction: DESC}) {
                  nodes {
            """ + PULL_REQUEST_FIELDS + """
                  }
                }
              }
            }
            """ + ROLLUP_FRAGMENT;

    static final String SINGLE_PULL_REQUEST_QUERY = """
            query SinglePullRequest($owner: String!, $name: String!, $number: Int!) {
              repository(owner: $owner, name: $name) {
                pullRequest(number: $number) {
            """ + PULL_REQUEST_FIELDS + """
                }
              }
            }
            """ + ROLLUP_FRAGMENT;

    private final WebClient githubWebClient;
    private final Duration timeout;

    public GithubClient(@Qualifier("githubWebClient") WebClient githubWebClient,
                        PrSyncProperties properties) {
        this.githubWebClient = githubWebClient;
        this.timeout = properties.http().timeout();
    }

    /**
     * Fetch open and merged pull requests of a repository, newest-updated first.
     *
     * @return raw GraphQL nodes; empty when the repository does not exist
     */
    @CircuitBreaker(name = "githubCircuitBreaker", fallbackMethod = "fetchRepoPullRequestsCircuitOpen")
    public List<JsonNode> fetchRepoPullRequests(String owner, String name, int limit) {
        log.debug("Fetching pull requests for repo={}/{}, limit={}", owner, name, limit);

        JsonNode data = execute(REPO_PULL_REQUESTS_QUERY, Map.of("owner", owner, "name", name, "first", limit));
        JsonNode repository = data.path("repository");
        if (repository.isMissingNode() || repository.isNull()) {
            log.warn("GitHub repository not found: {}/{}", owner, name);
            return List.of();
        }

        List<JsonNode> nodes = new ArrayList<>();
        repository.path("pullRequests").path("nodes").forEach(nodes::add);
        log.info("Fetched {} pull requests from GitHub repo={}/{}", nodes.size(), owner, name);
        return nodes;
    }

    /**
     * Fetch one pull request by number.
     *
     * @return the raw GraphQL node, or empty when the repository or pull request does not exist
     */
    @CircuitBreaker(name = "githubCircuitBreaker", fallbackMethod = "fetchSinglePullRequestCircuitOpen")
    public Optional<JsonNode> fetchSinglePullRequest(String owner, String name, int number) {
        log.debug("Fetching pull request {}/{}#{}", owner, name, number);

        JsonNode data = execute(SINGLE_PULL_REQUEST_QUERY, Map.of("owner", owner, "name", name, "number", number));
        JsonNode pullRequest = data.path("repository").path("pullRequest");
        if (pullRequest.isMissingNode() || pullRequest.isNull()) {
            log.warn("GitHub pull request not found: {}/{}#{}", owner, name, number);
            return Optional.empty();
        }
        return Optional.of(pullRequest);
    }

    private JsonNode execute(String query, Map<String, Object> variables) {
        JsonNode response;
        try {
            response = githubWebClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("query", query, "variables", variables))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse -> {
                        log.error("GitHub API error: {}", clientResponse.statusCode());
                        return Mono.error(new RemoteUnavailableException(REMOTE,
                                "GitHub API returned " + clientResponse.statusCode().value()));
                    })
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (RemoteUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("GitHub call failed: {}", e.getMessage());
            throw new RemoteUnavailableException(REMOTE, "GitHub call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new RemoteUnavailableException(REMOTE, "Empty response from GitHub");
        }
        JsonNode data = response.path("data");
        JsonNode errors = response.path("errors");
        if ((data.isMissingNode() || data.isNull()) && errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("unknown error");
            log.error("GitHub GraphQL errors: {}", message);
            throw new RemoteUnavailableException(REMOTE, "GitHub GraphQL error: " + message);
        }
        if (errors.isArray() && !errors.isEmpty()) {
            log.warn("GitHub GraphQL returned partial data with {} error(s): {}",
                    errors.size(), errors.get(0).path("message").asText());
        }
        return data;
    }

    private List<JsonNode> fetchRepoPullRequestsCircuitOpen(String owner, String name, int limit,
                                                            CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private Optional<JsonNode> fetchSinglePullRequestCircuitOpen(String owner, String name, int number,
                                                                 CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private RemoteUnavailableException circuitOpen(CallNotPermittedException e) {
        log.warn("GitHub circuit breaker open: {}", e.getMessage());
        return new RemoteUnavailableException(REMOTE, "GitHub circuit breaker open", e);
    }
}
