package com.example.prsync.client.external;

import com.example.prsync.config.PrSyncProperties;
import com.example.prsync.dto.IssueSnapshot;
import com.example.prsync.dto.JiraComponent;
import com.example.prsync.dto.TransitionStep;
import com.example.prsync.exception.ConfigurationGapException;
import com.example.prsync.exception.RemoteUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for Jira Cloud REST API v3.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional
 * - No retries; timeouts, transport faults and 5xx become {@link RemoteUnavailableException}
 * - 404 on an issue is a value (not-found snapshot), not an error
 * - 4xx on a mutation means Jira refused it; reported as {@code false}
 * - Circuit breaker protects against cascading failures
 */
@Component
@Slf4j
public class JiraClient {

    private static final String REMOTE = "jira";

    private final WebClient jiraWebClient;
    private final PrSyncProperties.Jira jira;
    private final Duration timeout;

    public JiraClient(@Qualifier("jiraWebClient") WebClient jiraWebClient,
                      PrSyncProperties properties) {
        this.jiraWebClient = jiraWebClient;
        this.jira = properties.jira();
        this.timeout = properties.http().timeout();
    }

    public boolean isEnabled() {
        return jira.enabled();
    }

    /**
     * Fetch summary, status, components and assignee of an issue.
     *
     * @return snapshot; {@link IssueSnapshot#notFound} on HTTP 404
     */
    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "fetchIssueCircuitOpen")
    public IssueSnapshot fetchIssue(String issueKey) {
        log.debug("Fetching Jira issue {}", issueKey);

        Optional<JsonNode> response = call("fetch issue " + issueKey, () -> jiraWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/rest/api/3/issue/{key}")
                        .queryParam("fields", "summary,status,components,assignee")
                        .build(issueKey))
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        clientResponse -> Mono.error(new NotFoundException()))
                .onStatus(HttpStatusCode::isError, this::remoteError)
                .bodyToMono(JsonNode.class));

        if (response.isEmpty()) {
            log.info("Jira issue not found: {}", issueKey);
            return IssueSnapshot.notFound(issueKey, jira.browseUrl(issueKey));
        }

        JsonNode fields = response.get().path("fields");
        List<String> components = new ArrayList<>();
        fields.path("components").forEach(component -> {
            String name = textOrNull(component.path("name"));
            if (name != null) {
                components.add(name);
            }
        });

        IssueSnapshot.Assignee assignee = null;
        JsonNode assigneeNode = fields.path("assignee");
        if (assigneeNode.isObject()) {
            assignee = new IssueSnapshot.Assignee(
                    textOrNull(assigneeNode.path("displayName")),
                    textOrNull(assigneeNode.path("emailAddress")),
                    textOrNull(assigneeNode.path("accountId")));
        }

        return IssueSnapshot.builder()
                .key(issueKey)
                .status(textOrNull(fields.path("status").path("name")))
                .summary(textOrNull(fields.path("summary")))
                .url(jira.browseUrl(issueKey))
                .components(components)
                .assignee(assignee)
                .found(true)
                .build();
    }

    /**
     * Transitions Jira currently permits from the issue's present status.
     */
    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "fetchTransitionsCircuitOpen")
    public List<TransitionStep> fetchTransitions(String issueKey) {
        Optional<JsonNode> response = call("fetch transitions " + issueKey, () -> jiraWebClient.get()
                .uri("/rest/api/3/issue/{key}/transitions", issueKey)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        clientResponse -> Mono.error(new NotFoundException()))
                .onStatus(HttpStatusCode::isError, this::remoteError)
                .bodyToMono(JsonNode.class));

        List<TransitionStep> transitions = new ArrayList<>();
        response.ifPresent(body -> body.path("transitions").forEach(node -> transitions.add(new TransitionStep(
                textOrNull(node.path("id")),
                textOrNull(node.path("name")),
                textOrNull(node.path("to").path("name"))))));
        log.debug("Jira issue {} permits {} transition(s)", issueKey, transitions.size());
        return transitions;
    }

    /**
     * @return true if Jira accepted the transition, false if it rejected it (4xx)
     */
    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "applyTransitionCircuitOpen")
    public boolean applyTransition(String issueKey, String transitionId) {
        log.info("Applying Jira transition {} to {}", transitionId, issueKey);
        return mutate("apply transition " + transitionId + " to " + issueKey, jiraWebClient.post()
                .uri("/rest/api/3/issue/{key}/transitions", issueKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("transition", Map.of("id", transitionId))));
    }

    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "fetchProjectComponentsCircuitOpen")
    public List<JiraComponent> fetchProjectComponents(String projectKey) {
        Optional<JsonNode> response = call("fetch components of " + projectKey, () -> jiraWebClient.get()
                .uri("/rest/api/3/project/{key}/components", projectKey)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                        clientResponse -> Mono.error(new NotFoundException()))
                .onStatus(HttpStatusCode::isError, this::remoteError)
                .bodyToMono(JsonNode.class));

        List<JiraComponent> components = new ArrayList<>();
        response.ifPresent(body -> body.forEach(node -> components.add(new JiraComponent(
                textOrNull(node.path("id")),
                textOrNull(node.path("name"))))));
        return components;
    }

    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "addComponentsCircuitOpen")
    public boolean addComponents(String issueKey, List<String> componentIds) {
        List<Map<String, Object>> operations = componentIds.stream()
                .<Map<String, Object>>map(id -> Map.of("add", Map.of("id", id)))
                .toList();
        log.info("Adding components {} to Jira issue {}", componentIds, issueKey);
        return mutate("add components to " + issueKey, jiraWebClient.put()
                .uri("/rest/api/3/issue/{key}", issueKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("update", Map.of("components", operations))));
    }

    /**
     * Look up the account id of the configured Jira email.
     */
    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "resolveAccountIdCircuitOpen")
    public Optional<String> resolveAccountId() {
        if (jira.email() == null || jira.email().isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> response = call("search user " + jira.email(), () -> jiraWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/rest/api/3/user/search")
                        .queryParam("query", jira.email())
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::remoteError)
                .bodyToMono(JsonNode.class));

        return response
                .filter(body -> body.isArray() && !body.isEmpty())
                .map(body -> textOrNull(body.get(0).path("accountId")));
    }

    /**
     * Assign the issue to the configured account.
     *
     * @throws ConfigurationGapException if no Jira account matches the configured email
     */
    @CircuitBreaker(name = "jiraCircuitBreaker", fallbackMethod = "assignIssueCircuitOpen")
    public boolean assignIssue(String issueKey) {
        String accountId = resolveAccountId()
                .orElseThrow(() -> new ConfigurationGapException(
                        "No Jira account found for configured email " + jira.email()));
        log.info("Assigning Jira issue {} to account {}", issueKey, accountId);
        return mutate("assign " + issueKey, jiraWebClient.put()
                .uri("/rest/api/3/issue/{key}/assignee", issueKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("accountId", accountId)));
    }

    private Optional<JsonNode> call(String operation, Supplier<Mono<JsonNode>> request) {
        try {
            return Optional.ofNullable(request.get().timeout(timeout).block());
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (RemoteUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("Jira call failed ({}): {}", operation, e.getMessage());
            throw new RemoteUnavailableException(REMOTE, "Jira call failed (" + operation + "): " + e.getMessage(), e);
        }
    }

    private boolean mutate(String operation, WebClient.RequestHeadersSpec<?> request) {
        try {
            HttpStatusCode status = request
                    .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode()))
                    .timeout(timeout)
                    .block();
            if (status == null || status.is5xxServerError()) {
                throw new RemoteUnavailableException(REMOTE, "Jira " + operation + " failed with " + status);
            }
            if (status.is4xxClientError()) {
                log.warn("Jira rejected {} ({})", operation, status.value());
                return false;
            }
            return true;
        } catch (RemoteUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.error("Jira call failed ({}): {}", operation, e.getMessage());
            throw new RemoteUnavailableException(REMOTE, "Jira call failed (" + operation + "): " + e.getMessage(), e);
        }
    }

    private Mono<? extends Throwable> remoteError(ClientResponse response) {
        log.error("Jira API error: {}", response.statusCode());
        return Mono.error(new RemoteUnavailableException(REMOTE, "Jira API returned " + response.statusCode().value()));
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private IssueSnapshot fetchIssueCircuitOpen(String issueKey, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private List<TransitionStep> fetchTransitionsCircuitOpen(String issueKey, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private boolean applyTransitionCircuitOpen(String issueKey, String transitionId, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private List<JiraComponent> fetchProjectComponentsCircuitOpen(String projectKey, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private boolean addComponentsCircuitOpen(String issueKey, List<String> componentIds, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private Optional<String> resolveAccountIdCircuitOpen(CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private boolean assignIssueCircuitOpen(String issueKey, CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private RemoteUnavailableException circuitOpen(CallNotPermittedException e) {
        log.warn("Jira circuit breaker open: {}", e.getMessage());
        return new RemoteUnavailableException(REMOTE, "Jira circuit breaker open", e);
    }

    /** 404 marker, turned into a value by {@link #call}. */
    private static class NotFoundException extends RuntimeException {
        NotFoundException() {
            super(null, null, false, false);
        }
    }
}
